package com.cario.catalog.app.model;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Orchestration policy, fixed for the lifetime of an orchestrator.
 *
 * <p>At least one path must be enabled; a configuration with both paths off is rejected when it
 * is built.
 */
@Value
public class ProcessingConfig {

  public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
  public static final Duration DEFAULT_OCR_TIMEOUT = Duration.ofSeconds(60);
  public static final Duration DEFAULT_VISION_TIMEOUT = Duration.ofSeconds(90);

  boolean enableOcrPath;
  boolean enableAiPath;
  double confidenceThreshold;
  MergeStrategy fallbackStrategy;
  Duration ocrTimeout;
  Duration visionTimeout;

  @Builder
  private ProcessingConfig(
      Boolean enableOcrPath,
      Boolean enableAiPath,
      Double confidenceThreshold,
      MergeStrategy fallbackStrategy,
      Duration ocrTimeout,
      Duration visionTimeout) {
    this.enableOcrPath = enableOcrPath == null || enableOcrPath;
    this.enableAiPath = enableAiPath == null || enableAiPath;
    this.confidenceThreshold =
        confidenceThreshold == null ? DEFAULT_CONFIDENCE_THRESHOLD : confidenceThreshold;
    this.fallbackStrategy =
        fallbackStrategy == null ? MergeStrategy.BEST_CONFIDENCE : fallbackStrategy;
    this.ocrTimeout = ocrTimeout == null ? DEFAULT_OCR_TIMEOUT : ocrTimeout;
    this.visionTimeout = visionTimeout == null ? DEFAULT_VISION_TIMEOUT : visionTimeout;

    if (!this.enableOcrPath && !this.enableAiPath) {
      throw new IllegalArgumentException("At least one of the OCR or AI paths must be enabled");
    }
    if (this.confidenceThreshold < 0.0 || this.confidenceThreshold > 1.0) {
      throw new IllegalArgumentException(
          "confidenceThreshold must be within [0, 1], got " + this.confidenceThreshold);
    }
  }

  public static ProcessingConfig defaults() {
    return ProcessingConfig.builder().build();
  }
}
