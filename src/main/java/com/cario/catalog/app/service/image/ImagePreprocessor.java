package com.cario.catalog.app.service.image;

import java.nio.file.Path;
import java.util.List;

/** Applies an ordered list of named transformations and writes the result to a temp file. */
public interface ImagePreprocessor {

  /**
   * @param image source image, never modified
   * @param steps step names (see {@link PreprocessStep}); unknown names are skipped with a warning
   * @return the derived image; its file must be deleted by the caller
   */
  PreprocessedImage apply(Path image, List<String> steps);
}
