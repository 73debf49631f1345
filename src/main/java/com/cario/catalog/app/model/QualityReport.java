package com.cario.catalog.app.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Aggregate of one full validation run. Stored append-only for trend analysis. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityReport {

  /** Store-assigned id; null until persisted. */
  private Long id;

  private int totalTests;
  private int passedTests;
  private double averageScore;
  private double averageProcessingTimeMs;

  /** Passed test count per result method tag. */
  private Map<String, Integer> methodBreakdown;

  /** Passed test count per test-case category. */
  private Map<String, Integer> categoryBreakdown;

  /** Up to five most frequent issues. */
  private List<String> commonIssues;

  /** Up to five most frequent recommendations. */
  private List<String> recommendations;

  private Instant timestamp;
}
