package com.cario.catalog.app.model;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Score of one test case in one validation run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

  private String testCaseId;
  private boolean passed;

  /** Weighted score in [0, 1]. */
  private double score;

  private Details details;

  @Builder.Default private List<String> issues = List.of();

  @Builder.Default private List<String> recommendations = List.of();

  private Instant validatedAt;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Details {
    private double textAccuracy;
    private double objectAccuracy;
    private double confidenceScore;
    private long processingTimeMs;
    private String method;
  }
}
