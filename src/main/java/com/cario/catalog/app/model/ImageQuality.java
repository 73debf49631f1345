package com.cario.catalog.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Coarse suitability assessment of a source image for text extraction. */
@Value
@Builder
public class ImageQuality {

  /** One of {@code good}, {@code medium}, {@code low}, {@code unknown}. */
  String quality;

  Integer width;
  Integer height;
  Long fileSize;

  @Builder.Default List<String> recommendations = List.of();
}
