package com.cario.catalog.app.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Structured answer of the vision model for a single image. */
@Value
@Builder(toBuilder = true)
public class VisionResult {

  public static final String METHOD = "ai_vision";

  @Builder.Default String extractedText = "";

  @Builder.Default List<String> detectedObjects = List.of();

  @Builder.Default String description = "";

  /** Model-reported confidence clamped to [0, 1]. */
  double confidence;

  @Builder.Default String method = METHOD;

  /** Diagnostic notes (model extraction notes, or why the path degraded). */
  String reasoning;

  /** brand / model / barcode / specifications, when the model located them. */
  @Builder.Default Map<String, String> textLocations = Map.of();

  /** Model identifier used for the call (null for placeholders). */
  String model;

  /** Empty-confidence placeholder used when the vision path did not produce a result. */
  public static VisionResult placeholder(String reasoning) {
    return VisionResult.builder().confidence(0.0).reasoning(reasoning).build();
  }
}
