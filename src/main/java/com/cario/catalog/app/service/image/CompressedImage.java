package com.cario.catalog.app.service.image;

import lombok.Builder;
import lombok.Value;

/** JPEG payload prepared for the vision model. */
@Value
@Builder
public class CompressedImage {
  byte[] bytes;
  String mimeType;
  int width;
  int height;
  long originalSize;
}
