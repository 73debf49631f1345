package com.cario.catalog.app.service.vision;

import com.cario.catalog.app.config.CatalogProperties;
import com.cario.catalog.app.model.ImageQuality;
import com.cario.catalog.app.model.VisionResult;
import com.cario.catalog.app.prompt.PromptConfig;
import com.cario.catalog.app.service.image.CompressedImage;
import com.cario.catalog.app.service.image.ImageCompressor;
import com.cario.catalog.app.service.image.ImageQualityAnalyzer;
import com.cario.catalog.app.util.TextUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;

/**
 * Vision path: compress the image, ask the model for the structured extraction, and turn the
 * answer into a {@link VisionResult}.
 *
 * <p>A non-JSON answer is not an error; its raw text becomes both the extracted text and the
 * description. Transport failures of the client propagate.
 */
@Log4j2
public class VisionExtractor {

  static final double DEFAULT_CONFIDENCE = 0.8;
  static final String DEFAULT_OBJECT = "product";
  static final String DEFAULT_REASONING = "Enhanced AI vision analysis";
  static final String NOT_JSON_REASONING = "Response was not in JSON format";

  private static final Pattern CODE_FENCE =
      Pattern.compile("^```(?:json|JSON)?\\s*(.*?)\\s*```$", Pattern.DOTALL);

  private final VisionClient client;
  private final ImageCompressor compressor;
  private final ImageQualityAnalyzer qualityAnalyzer;
  private final PromptConfig prompt;
  private final CatalogProperties.Vision settings;
  private final Map<String, Object> responseSchema;
  private final ObjectMapper om =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  public VisionExtractor(
      VisionClient client,
      ImageCompressor compressor,
      ImageQualityAnalyzer qualityAnalyzer,
      PromptConfig prompt,
      CatalogProperties.Vision settings) {
    this.client = Objects.requireNonNull(client);
    this.compressor = Objects.requireNonNull(compressor);
    this.qualityAnalyzer = Objects.requireNonNull(qualityAnalyzer);
    this.prompt = Objects.requireNonNull(prompt);
    this.settings = Objects.requireNonNull(settings);
    this.responseSchema =
        settings.isStructuredOutput() ? VisionSchemaFactory.responseSchema() : null;
  }

  public VisionResult extract(Path image) {
    long t0 = System.nanoTime();
    CompressedImage compressed =
        compressor.compress(image, settings.getMaxImageSize(), settings.getCompressionQuality());
    log.info(
        "vision.compressed image={} originalBytes={} compressedBytes={} size={}x{}",
        image.getFileName(),
        compressed.getOriginalSize(),
        compressed.getBytes().length,
        compressed.getWidth(),
        compressed.getHeight());

    String content =
        client.complete(
            VisionRequest.builder()
                .imageBytes(compressed.getBytes())
                .mimeType(compressed.getMimeType())
                .systemPrompt(prompt.renderSystem())
                .userPrompt(prompt.getUserTemplate())
                .model(settings.getModel())
                .temperature(settings.getTemperature())
                .maxTokens(settings.getMaxTokens())
                .responseSchema(responseSchema)
                .build());

    VisionResult result = parse(content, settings.getModel());
    log.info(
        "vision.done image={} model={} confidence={} objects={} durationMs={} text=\"{}\"",
        image.getFileName(),
        settings.getModel(),
        String.format("%.2f", result.getConfidence()),
        result.getDetectedObjects(),
        (System.nanoTime() - t0) / 1_000_000,
        TextUtils.truncate(result.getExtractedText(), 100));
    return result;
  }

  /** Never throws; delegates to {@link ImageQualityAnalyzer}. */
  public ImageQuality analyzeImageQuality(Path image) {
    return qualityAnalyzer.analyze(image);
  }

  VisionResult parse(String content, String model) {
    String raw = content == null ? "" : content.strip();
    VisionResponse response;
    try {
      response = om.readValue(stripCodeFence(raw), VisionResponse.class);
    } catch (JsonProcessingException e) {
      log.warn("vision.parse.notJson model={} msg={}", model, e.getOriginalMessage());
      response = null;
    }
    if (response == null) {
      return VisionResult.builder()
          .extractedText(raw)
          .description(raw)
          .detectedObjects(List.of(DEFAULT_OBJECT))
          .confidence(DEFAULT_CONFIDENCE)
          .reasoning(NOT_JSON_REASONING)
          .model(model)
          .build();
    }

    double confidence =
        response.getConfidence() == null ? DEFAULT_CONFIDENCE : response.getConfidence();
    return VisionResult.builder()
        .extractedText(Objects.toString(response.getExtractedText(), ""))
        .description(Objects.toString(response.getDescription(), ""))
        .detectedObjects(
            response.getDetectedObjects() == null
                ? List.of(DEFAULT_OBJECT)
                : dedupe(response.getDetectedObjects()))
        .confidence(Math.max(0.0, Math.min(1.0, confidence)))
        .reasoning(
            TextUtils.isBlank(response.getExtractionNotes())
                ? DEFAULT_REASONING
                : response.getExtractionNotes())
        .textLocations(toMap(response.getTextLocations()))
        .model(model)
        .build();
  }

  static String stripCodeFence(String raw) {
    Matcher m = CODE_FENCE.matcher(raw);
    return m.matches() ? m.group(1) : raw;
  }

  private static List<String> dedupe(List<String> objects) {
    Set<String> out = new LinkedHashSet<>();
    for (String o : objects) {
      if (!TextUtils.isBlank(o)) {
        out.add(o.trim());
      }
    }
    return List.copyOf(out);
  }

  private static Map<String, String> toMap(VisionResponse.TextLocations locations) {
    if (locations == null) {
      return Map.of();
    }
    Map<String, String> out = new LinkedHashMap<>();
    putIfPresent(out, "brand", locations.getBrand());
    putIfPresent(out, "model", locations.getModel());
    putIfPresent(out, "barcode", locations.getBarcode());
    putIfPresent(out, "specifications", locations.getSpecifications());
    return out;
  }

  private static void putIfPresent(Map<String, String> map, String key, String value) {
    if (!TextUtils.isBlank(value)) {
      map.put(key, value);
    }
  }
}
