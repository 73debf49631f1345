package com.cario.catalog.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Rule used to reconcile the OCR and vision paths into one result. */
public enum MergeStrategy {
  OCR_ONLY("ocr_only"),
  AI_ONLY("ai_only"),
  BEST_CONFIDENCE("best_confidence"),
  MERGE_ALL("merge_all");

  private final String tag;

  MergeStrategy(String tag) {
    this.tag = tag;
  }

  @JsonValue
  public String getTag() {
    return tag;
  }

  @JsonCreator
  public static MergeStrategy fromTag(String value) {
    return Arrays.stream(values())
        .filter(s -> s.tag.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown merge strategy: " + value));
  }
}
