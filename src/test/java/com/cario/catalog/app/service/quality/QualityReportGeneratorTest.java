package com.cario.catalog.app.service.quality;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.catalog.app.model.QualityReport;
import com.cario.catalog.app.model.TestCase;
import com.cario.catalog.app.model.ValidationResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QualityReportGeneratorTest {

  private static final Instant TS = Instant.parse("2025-09-01T00:00:00Z");

  private static TestCase tc(String id, String category) {
    return TestCase.builder()
        .id(id)
        .imageReference(id + ".jpg")
        .expectedTextFragments(List.of())
        .expectedObjectLabels(List.of())
        .category(category)
        .build();
  }

  private static ValidationResult result(
      String id, boolean passed, double score, long ms, String method, List<String> issues) {
    return ValidationResult.builder()
        .testCaseId(id)
        .passed(passed)
        .score(score)
        .details(ValidationResult.Details.builder().processingTimeMs(ms).method(method).build())
        .issues(issues)
        .recommendations(List.of())
        .build();
  }

  @Test
  void emptyRunHasZeroAverages() {
    QualityReport r = QualityReportGenerator.generate(List.of(), List.of(), TS);

    assertEquals(0, r.getTotalTests());
    assertEquals(0.0, r.getAverageScore(), 1e-9);
    assertEquals(0.0, r.getAverageProcessingTimeMs(), 1e-9);
    assertTrue(r.getMethodBreakdown().isEmpty());
    assertTrue(r.getCommonIssues().isEmpty());
    assertEquals(TS, r.getTimestamp());
  }

  @Test
  void breakdownsCountPassedResultsOnly() {
    List<TestCase> cases =
        List.of(tc("a", "barcode"), tc("b", "barcode"), tc("c", "electronics"));
    List<ValidationResult> results =
        List.of(
            result("a", true, 0.9, 1000, "ocr_primary", List.of()),
            result("b", true, 0.8, 2000, "ai_vision_primary", List.of()),
            result("c", false, 0.4, 3000, "ocr_primary", List.of("Poor object detection")));

    QualityReport r = QualityReportGenerator.generate(cases, results, TS);

    assertEquals(3, r.getTotalTests());
    assertEquals(2, r.getPassedTests());
    assertEquals(0.7, r.getAverageScore(), 1e-9);
    assertEquals(2000.0, r.getAverageProcessingTimeMs(), 1e-9);
    assertEquals(Map.of("ocr_primary", 1, "ai_vision_primary", 1), r.getMethodBreakdown());
    assertEquals(Map.of("barcode", 2), r.getCategoryBreakdown());
    assertEquals(List.of("Poor object detection"), r.getCommonIssues());
  }

  @Test
  void mostFrequentKeepsTopFiveStably() {
    List<String> top =
        QualityReportGenerator.mostFrequent(
            List.of("b", "a", "c", "a", "d", "e", "f", "g", "c", "a"));

    assertEquals(List.of("a", "c", "b", "d", "e"), top);
  }
}
