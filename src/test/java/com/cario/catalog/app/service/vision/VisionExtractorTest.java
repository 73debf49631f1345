package com.cario.catalog.app.service.vision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cario.catalog.app.config.CatalogProperties;
import com.cario.catalog.app.exception.VisionApiException;
import com.cario.catalog.app.model.ImageQuality;
import com.cario.catalog.app.model.VisionResult;
import com.cario.catalog.app.prompt.PromptConfig;
import com.cario.catalog.app.service.image.CompressedImage;
import com.cario.catalog.app.service.image.ImageCompressor;
import com.cario.catalog.app.service.image.ImageQualityAnalyzer;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VisionExtractorTest {

  private static final Path IMAGE = Path.of("label.jpg");

  @Mock private VisionClient client;
  @Mock private ImageCompressor compressor;
  @Mock private ImageQualityAnalyzer qualityAnalyzer;

  private CatalogProperties.Vision settings;
  private VisionExtractor extractor;

  @BeforeEach
  void setUp() {
    PromptConfig prompt = new PromptConfig();
    prompt.setSystemTemplate("Extract all text.");
    prompt.setUserTemplate("Analyze this product image.");
    prompt.setRules(Map.of("focus", "brand and model"));
    settings = new CatalogProperties.Vision();
    extractor = new VisionExtractor(client, compressor, qualityAnalyzer, prompt, settings);
  }

  private void stubCompression() {
    when(compressor.compress(IMAGE, 1024, 85))
        .thenReturn(
            CompressedImage.builder()
                .bytes(new byte[] {1, 2, 3})
                .mimeType("image/jpeg")
                .width(1024)
                .height(768)
                .originalSize(2_000_000)
                .build());
  }

  @Test
  void extractSendsCompressedImageWithPromptAndSchema() {
    stubCompression();
    when(client.complete(any()))
        .thenReturn(
            "{\"extracted_text\":\"ACME | X-200\",\"detected_objects\":[\"drill\"],"
                + "\"description\":\"Cordless drill\",\"confidence\":0.92,"
                + "\"text_locations\":{\"brand\":\"ACME\",\"model\":\"X-200\",\"barcode\":\"\"},"
                + "\"extraction_notes\":\"clear label\"}");

    VisionResult result = extractor.extract(IMAGE);

    ArgumentCaptor<VisionRequest> captor = ArgumentCaptor.forClass(VisionRequest.class);
    verify(client).complete(captor.capture());
    VisionRequest request = captor.getValue();
    assertEquals("gpt-4o", request.getModel());
    assertEquals("image/jpeg", request.getMimeType());
    assertEquals(1500, request.getMaxTokens());
    assertEquals(0.1, request.getTemperature(), 1e-9);
    assertEquals("Analyze this product image.", request.getUserPrompt());
    assertTrue(request.getSystemPrompt().contains("- focus: brand and model"));
    assertNotNull(request.getResponseSchema());

    assertEquals("ACME | X-200", result.getExtractedText());
    assertEquals(List.of("drill"), result.getDetectedObjects());
    assertEquals(0.92, result.getConfidence(), 1e-9);
    assertEquals("clear label", result.getReasoning());
    assertEquals(Map.of("brand", "ACME", "model", "X-200"), result.getTextLocations());
    assertEquals(VisionResult.METHOD, result.getMethod());
    assertEquals("gpt-4o", result.getModel());
  }

  @Test
  void freeTextModeSendsNoSchema() {
    settings.setStructuredOutput(false);
    PromptConfig prompt = new PromptConfig();
    prompt.setSystemTemplate("s");
    VisionExtractor freeText =
        new VisionExtractor(client, compressor, qualityAnalyzer, prompt, settings);
    stubCompression();
    when(client.complete(any())).thenReturn("{}");

    freeText.extract(IMAGE);

    ArgumentCaptor<VisionRequest> captor = ArgumentCaptor.forClass(VisionRequest.class);
    verify(client).complete(captor.capture());
    assertNull(captor.getValue().getResponseSchema());
  }

  @Test
  void clientFailurePropagates() {
    stubCompression();
    when(client.complete(any()))
        .thenThrow(
            new VisionApiException(VisionApiException.Category.RATE_LIMIT, "slow down", null));

    VisionApiException ex = assertThrows(VisionApiException.class, () -> extractor.extract(IMAGE));
    assertTrue(ex.isRateLimited());
  }

  @Test
  void qualityAnalysisIsDelegated() {
    ImageQuality quality = ImageQuality.builder().quality("good").build();
    when(qualityAnalyzer.analyze(IMAGE)).thenReturn(quality);
    assertSame(quality, extractor.analyzeImageQuality(IMAGE));
  }

  // ---------- parse ----------

  @Test
  void nonJsonAnswerBecomesTextAndDescription() {
    VisionResult r = extractor.parse("I can see a blue box labelled ACME.", "gpt-4o");
    assertEquals("I can see a blue box labelled ACME.", r.getExtractedText());
    assertEquals("I can see a blue box labelled ACME.", r.getDescription());
    assertEquals(List.of("product"), r.getDetectedObjects());
    assertEquals(0.8, r.getConfidence(), 1e-9);
    assertEquals(VisionExtractor.NOT_JSON_REASONING, r.getReasoning());
  }

  @Test
  void fencedJsonIsUnwrapped() {
    VisionResult r =
        extractor.parse("```json\n{\"extracted_text\":\"SKU 42\",\"confidence\":0.7}\n```", "m");
    assertEquals("SKU 42", r.getExtractedText());
    assertEquals(0.7, r.getConfidence(), 1e-9);
  }

  @Test
  void missingFieldsGetDefaults() {
    VisionResult r = extractor.parse("{\"extracted_text\":\"hello\"}", "m");
    assertEquals("", r.getDescription());
    assertEquals(List.of("product"), r.getDetectedObjects());
    assertEquals(0.8, r.getConfidence(), 1e-9);
    assertEquals(VisionExtractor.DEFAULT_REASONING, r.getReasoning());
    assertTrue(r.getTextLocations().isEmpty());
  }

  @Test
  void explicitEmptyObjectListAndZeroConfidenceAreKept() {
    VisionResult r = extractor.parse("{\"detected_objects\":[],\"confidence\":0}", "m");
    assertTrue(r.getDetectedObjects().isEmpty());
    assertEquals(0.0, r.getConfidence(), 1e-9);
  }

  @Test
  void confidenceIsClampedAndObjectsDeduplicated() {
    VisionResult r =
        extractor.parse(
            "{\"detected_objects\":[\" box \",\"box\",\"\",\"label\"],\"confidence\":1.7}", "m");
    assertEquals(List.of("box", "label"), r.getDetectedObjects());
    assertEquals(1.0, r.getConfidence(), 1e-9);
  }

  @Test
  void stripCodeFenceLeavesPlainJsonAlone() {
    assertEquals("{\"a\":1}", VisionExtractor.stripCodeFence("{\"a\":1}"));
    assertEquals("{\"a\":1}", VisionExtractor.stripCodeFence("```\n{\"a\":1}\n```"));
  }
}
