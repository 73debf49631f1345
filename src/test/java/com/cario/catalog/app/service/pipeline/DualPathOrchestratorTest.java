package com.cario.catalog.app.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.cario.catalog.app.exception.OcrEngineUnavailableException;
import com.cario.catalog.app.exception.VisionApiException;
import com.cario.catalog.app.model.ExtractionResult;
import com.cario.catalog.app.model.ImageQuality;
import com.cario.catalog.app.model.MergeStrategy;
import com.cario.catalog.app.model.OrchestrationResult;
import com.cario.catalog.app.model.ProcessingConfig;
import com.cario.catalog.app.model.VisionResult;
import com.cario.catalog.app.service.ocr.MultiStrategyOcrRunner;
import com.cario.catalog.app.service.vision.VisionExtractor;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DualPathOrchestratorTest {

  private static final Path IMAGE = Path.of("drill.jpg");

  @Mock private MultiStrategyOcrRunner ocrRunner;
  @Mock private VisionExtractor visionExtractor;

  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private DualPathOrchestrator orchestrator(ProcessingConfig config) {
    return new DualPathOrchestrator(ocrRunner, visionExtractor, executor, config);
  }

  private static ExtractionResult ocr(String text, double confidence) {
    return ExtractionResult.builder()
        .text(text)
        .confidence(confidence)
        .method("product_labels")
        .build();
  }

  private static VisionResult vision(String text, double confidence) {
    return VisionResult.builder()
        .extractedText(text)
        .description("Cordless drill")
        .detectedObjects(List.of("drill"))
        .confidence(confidence)
        .model("gpt-4o")
        .build();
  }

  @Test
  void bothPathsSucceedAndVisionWins() {
    ImageQuality quality = ImageQuality.builder().quality("good").build();
    when(ocrRunner.runAll(IMAGE)).thenReturn(List.of(ocr("ACME 18V", 0.75)));
    when(visionExtractor.extract(IMAGE)).thenReturn(vision("ACME Drill 18V", 0.9));
    when(visionExtractor.analyzeImageQuality(IMAGE)).thenReturn(quality);

    OrchestrationResult r = orchestrator(ProcessingConfig.defaults()).processImage(IMAGE);

    assertTrue(r.isSuccess());
    assertNull(r.getError());
    assertEquals("ACME Drill 18V", r.getFinalText());
    assertEquals("ai_vision_primary", r.getMethod());
    assertEquals(0.9, r.getFinalConfidence(), 1e-9);
    assertEquals("best_confidence_ai", r.getProcessingDetails().getMergeStrategy());
    assertEquals(1, r.getProcessingDetails().getOcrResults().size());
    assertEquals(1, r.getProcessingDetails().getQualityScores().getOcrMethodsAttempted());
    assertSame(quality, r.getProcessingDetails().getImageQuality());
    assertTrue(r.getProcessingTimeMs() >= 0);
  }

  @Test
  void disabledAiPathUsesPlaceholderAndNeverCallsVision() {
    when(ocrRunner.runAll(IMAGE)).thenReturn(List.of(ocr("ACME 18V", 0.85)));

    OrchestrationResult r =
        orchestrator(ProcessingConfig.builder().enableAiPath(false).build()).processImage(IMAGE);

    assertTrue(r.isSuccess());
    assertEquals("ocr_primary", r.getMethod());
    VisionResult placeholder = r.getProcessingDetails().getVisionResult();
    assertEquals(0.0, placeholder.getConfidence(), 1e-9);
    assertEquals(DualPathOrchestrator.AI_DISABLED, placeholder.getReasoning());
    verify(visionExtractor, never()).extract(IMAGE);
  }

  @Test
  void disabledOcrPathLeavesOcrResultsEmpty() {
    when(visionExtractor.extract(IMAGE)).thenReturn(vision("label", 0.5));

    OrchestrationResult r =
        orchestrator(ProcessingConfig.builder().enableOcrPath(false).build()).processImage(IMAGE);

    assertTrue(r.getProcessingDetails().getOcrResults().isEmpty());
    assertEquals("merged_ocr_ai", r.getMethod());
    assertEquals("low_confidence_merge", r.getProcessingDetails().getMergeStrategy());
    assertEquals(0.25, r.getFinalConfidence(), 1e-9);
    verify(ocrRunner, never()).runAll(IMAGE);
  }

  @Test
  void visionFailureDegradesToPlaceholder() {
    when(ocrRunner.runAll(IMAGE)).thenReturn(List.of(ocr("ACME 18V", 0.8)));
    when(visionExtractor.extract(IMAGE))
        .thenThrow(
            new VisionApiException(VisionApiException.Category.RATE_LIMIT, "slow down", null));

    OrchestrationResult r = orchestrator(ProcessingConfig.defaults()).processImage(IMAGE);

    assertTrue(r.isSuccess());
    assertEquals("ocr_primary", r.getMethod());
    assertEquals(
        DualPathOrchestrator.AI_FAILED_PREFIX + "slow down",
        r.getProcessingDetails().getVisionResult().getReasoning());
  }

  @Test
  void slowOcrTimesOutWithoutBlockingVision() {
    when(ocrRunner.runAll(IMAGE))
        .thenAnswer(
            inv -> {
              Thread.sleep(5_000);
              return List.of(ocr("too late", 0.9));
            });
    when(visionExtractor.extract(IMAGE)).thenReturn(vision("ACME Drill", 0.9));

    ProcessingConfig config =
        ProcessingConfig.builder().ocrTimeout(Duration.ofMillis(200)).build();
    OrchestrationResult r = orchestrator(config).processImage(IMAGE);

    assertTrue(r.isSuccess());
    assertTrue(r.getProcessingDetails().getOcrResults().isEmpty());
    assertEquals("ai_vision_primary", r.getMethod());
    assertTrue(r.getProcessingTimeMs() < 5_000, "took " + r.getProcessingTimeMs() + "ms");
  }

  @Test
  void slowVisionTimesOutIntoPlaceholder() {
    when(ocrRunner.runAll(IMAGE)).thenReturn(List.of(ocr("ACME 18V", 0.8)));
    when(visionExtractor.extract(IMAGE))
        .thenAnswer(
            inv -> {
              Thread.sleep(5_000);
              return vision("too late", 0.9);
            });

    ProcessingConfig config =
        ProcessingConfig.builder().visionTimeout(Duration.ofMillis(200)).build();
    OrchestrationResult r = orchestrator(config).processImage(IMAGE);

    assertEquals("ocr_primary", r.getMethod());
    assertEquals(
        DualPathOrchestrator.AI_FAILED_PREFIX + "AI vision timed out after 200ms",
        r.getProcessingDetails().getVisionResult().getReasoning());
  }

  @Test
  void bothPathsFailingIsReportedAsFailure() {
    when(ocrRunner.runAll(IMAGE))
        .thenThrow(new OcrEngineUnavailableException("tesseract not installed"));
    when(visionExtractor.extract(IMAGE)).thenThrow(new IllegalStateException("401 unauthorized"));

    OrchestrationResult r = orchestrator(ProcessingConfig.defaults()).processImage(IMAGE);

    assertFalse(r.isSuccess());
    assertEquals(
        "OCR processing failed: tesseract not installed; AI processing failed: 401 unauthorized",
        r.getError());
    assertEquals("error", r.getMethod());
    assertEquals(List.of("error"), r.getFinalObjects());
    assertEquals(0.1, r.getFinalConfidence(), 1e-9);
  }

  @Test
  void onlyEnabledPathFailingIsReportedAsFailure() {
    when(ocrRunner.runAll(IMAGE)).thenThrow(new OcrEngineUnavailableException("no tessdata"));

    OrchestrationResult r =
        orchestrator(ProcessingConfig.builder().enableAiPath(false).build()).processImage(IMAGE);

    assertFalse(r.isSuccess());
    assertEquals("OCR processing failed: no tessdata", r.getError());
    assertEquals(List.of("error"), r.getFinalObjects());
    verify(visionExtractor, never()).extract(IMAGE);
  }

  @Test
  void missingImagePathIsReportedNotThrown() {
    OrchestrationResult r = orchestrator(ProcessingConfig.defaults()).processImage(null);

    assertFalse(r.isSuccess());
    assertEquals(DualPathOrchestrator.NO_IMAGE, r.getError());
    verifyNoInteractions(ocrRunner, visionExtractor);
  }

  @Test
  void adapterLabelEndToEnd() {
    when(ocrRunner.runAll(IMAGE)).thenReturn(List.of(ocr("MODEL-X200 12V 2A", 0.6)));
    when(visionExtractor.extract(IMAGE))
        .thenReturn(
            VisionResult.builder()
                .extractedText("MODEL-X200 12V 2A Adapter")
                .description("Power adapter")
                .detectedObjects(List.of("power_supply"))
                .confidence(0.9)
                .build());

    OrchestrationResult r = orchestrator(ProcessingConfig.defaults()).processImage(IMAGE);

    assertTrue(r.isSuccess());
    assertEquals("ai_vision_primary", r.getMethod());
    assertEquals(0.9, r.getFinalConfidence(), 1e-9);
    assertEquals("MODEL-X200 12V 2A Adapter", r.getFinalText());
    assertEquals(List.of("power_supply"), r.getFinalObjects());
  }

  @Test
  void unexpectedFailureBecomesErrorResult() {
    when(ocrRunner.runAll(IMAGE)).thenReturn(List.of(ocr("ACME", 0.8)));
    when(visionExtractor.extract(IMAGE)).thenReturn(vision("ACME", 0.9));
    when(visionExtractor.analyzeImageQuality(IMAGE)).thenThrow(new IllegalStateException("bug"));

    OrchestrationResult r =
        orchestrator(ProcessingConfig.builder().fallbackStrategy(MergeStrategy.MERGE_ALL).build())
            .processImage(IMAGE);

    assertFalse(r.isSuccess());
    assertEquals("bug", r.getError());
    assertEquals("error", r.getMethod());
    assertEquals(List.of("error"), r.getFinalObjects());
    assertEquals(0.1, r.getFinalConfidence(), 1e-9);
    assertEquals("error", r.getProcessingDetails().getMergeStrategy());
    assertEquals("Failed", r.getProcessingDetails().getVisionResult().getReasoning());
  }
}
