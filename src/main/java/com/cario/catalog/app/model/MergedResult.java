package com.cario.catalog.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Reconciled output of one orchestration call, before timing and diagnostics are attached. */
@Value
@Builder(toBuilder = true)
public class MergedResult {
  String text;
  String description;
  List<String> objects;
  double confidence;

  /** Which path(s) contributed, e.g. {@code ai_vision_primary}, {@code merged_ocr_ai}. */
  String method;

  /** Which merge rule fired, e.g. {@code best_confidence_ocr}, {@code low_confidence_merge}. */
  String strategy;
}
