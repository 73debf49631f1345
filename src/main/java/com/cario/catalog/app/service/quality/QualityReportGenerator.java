package com.cario.catalog.app.service.quality;

import com.cario.catalog.app.model.QualityReport;
import com.cario.catalog.app.model.TestCase;
import com.cario.catalog.app.model.ValidationResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Aggregates the results of one validation run. */
public final class QualityReportGenerator {

  static final int TOP_N = 5;

  private QualityReportGenerator() {}

  /**
   * @param testCases the cases that were run, used for the category breakdown
   * @param results one result per case
   */
  public static QualityReport generate(
      List<TestCase> testCases, List<ValidationResult> results, Instant timestamp) {
    int total = results.size();
    int passed = (int) results.stream().filter(ValidationResult::isPassed).count();
    double avgScore =
        total == 0 ? 0.0 : results.stream().mapToDouble(ValidationResult::getScore).sum() / total;
    double avgTime =
        total == 0
            ? 0.0
            : results.stream().mapToDouble(QualityReportGenerator::processingTimeOf).sum() / total;

    Map<String, Integer> methodBreakdown = new LinkedHashMap<>();
    Map<String, Integer> categoryBreakdown = new LinkedHashMap<>();
    Map<String, TestCase> byId =
        testCases.stream()
            .collect(
                Collectors.toMap(
                    TestCase::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    for (ValidationResult r : results) {
      if (!r.isPassed()) {
        continue;
      }
      String method =
          r.getDetails() == null || r.getDetails().getMethod() == null
              ? "unknown"
              : r.getDetails().getMethod();
      methodBreakdown.merge(method, 1, Integer::sum);
      TestCase tc = byId.get(r.getTestCaseId());
      if (tc != null) {
        String category = tc.getCategory() == null ? TestCase.DEFAULT_CATEGORY : tc.getCategory();
        categoryBreakdown.merge(category, 1, Integer::sum);
      }
    }

    return QualityReport.builder()
        .totalTests(total)
        .passedTests(passed)
        .averageScore(avgScore)
        .averageProcessingTimeMs(avgTime)
        .methodBreakdown(methodBreakdown)
        .categoryBreakdown(categoryBreakdown)
        .commonIssues(
            mostFrequent(results.stream().flatMap(r -> r.getIssues().stream()).toList()))
        .recommendations(
            mostFrequent(
                results.stream().flatMap(r -> r.getRecommendations().stream()).toList()))
        .timestamp(timestamp)
        .build();
  }

  private static double processingTimeOf(ValidationResult r) {
    return r.getDetails() == null ? 0 : r.getDetails().getProcessingTimeMs();
  }

  /** Top entries by count; equal counts keep first-occurrence order. */
  static List<String> mostFrequent(List<String> values) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    values.forEach(v -> counts.merge(v, 1, Integer::sum));
    List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
    entries.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
    return entries.stream().limit(TOP_N).map(Map.Entry::getKey).toList();
  }
}
