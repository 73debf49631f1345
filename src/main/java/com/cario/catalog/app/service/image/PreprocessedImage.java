package com.cario.catalog.app.service.image;

import java.nio.file.Path;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A derived image written by {@link ImagePreprocessor}. The caller owns {@link #getPath()} and
 * deletes it once the OCR call is done.
 */
@Value
@Builder
public class PreprocessedImage {
  Path path;

  /** Recognised step names, in the order they ran. */
  List<String> appliedSteps;

  /** One outcome note per applied step, e.g. {@code deskew: rotated by 2.10 degrees}. */
  List<String> notes;
}
