package com.cario.catalog.app.service.image;

import java.util.Arrays;
import java.util.Optional;

/** Transformations understood by {@link ImagePreprocessor}. */
public enum PreprocessStep {
  ENHANCE_CONTRAST("enhance_contrast"),
  DENOISE("denoise"),
  SHARPEN("sharpen"),
  UPSCALE("upscale"),
  DESKEW("deskew");

  private final String stepName;

  PreprocessStep(String stepName) {
    this.stepName = stepName;
  }

  public String getStepName() {
    return stepName;
  }

  public static Optional<PreprocessStep> fromName(String name) {
    return Arrays.stream(values()).filter(s -> s.stepName.equalsIgnoreCase(name)).findFirst();
  }
}
