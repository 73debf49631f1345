package com.cario.catalog.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Output of one OCR strategy run.
 *
 * <p>{@code preprocessingApplied} lists the transform names the strategy asked for, in order;
 * {@code preprocessingNotes} carries what the preprocessor actually did for each of them (a
 * best-effort step such as deskew may report that it left the image untouched).
 */
@Value
@Builder(toBuilder = true)
public class ExtractionResult {

  /** Trimmed engine text (may be empty). */
  String text;

  /** Heuristic confidence, always within [0.1, 0.95]. */
  double confidence;

  /** Strategy name, e.g. {@code product_labels}. */
  String method;

  @Builder.Default List<String> preprocessingApplied = List.of();

  @Builder.Default List<String> preprocessingNotes = List.of();
}
