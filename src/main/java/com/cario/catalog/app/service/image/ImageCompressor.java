package com.cario.catalog.app.service.image;

import java.nio.file.Path;

/** Shrinks an image to fit a bounding box and re-encodes it as JPEG. */
public interface ImageCompressor {

  /**
   * @param maxDimension the longer side of the result never exceeds this; smaller images are not
   *     enlarged
   * @param jpegQuality 1..100
   */
  CompressedImage compress(Path image, int maxDimension, int jpegQuality);
}
