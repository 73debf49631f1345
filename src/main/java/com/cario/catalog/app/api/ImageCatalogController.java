package com.cario.catalog.app.api;

import com.cario.catalog.app.model.OrchestrationResult;
import com.cario.catalog.app.model.ProcessedImageRecord;
import com.cario.catalog.app.model.QualityReport;
import com.cario.catalog.app.model.TestCase;
import com.cario.catalog.app.model.ValidationResult;
import com.cario.catalog.app.service.pipeline.ImageCatalogService;
import com.cario.catalog.app.service.quality.QualityValidator;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Locale;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@Log4j2
@Validated
@RestController
@RequestMapping("/catalog")
@RequiredArgsConstructor
public class ImageCatalogController {

  static final String TEST_TYPE_FULL = "full";
  static final String TEST_TYPE_SINGLE = "single";

  private final ImageCatalogService imageCatalogService;
  private final QualityValidator qualityValidator;

  // ------------------------------------------------------------
  // /catalog/process
  // ------------------------------------------------------------
  @PostMapping(
      path = "/process",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<OrchestrationResult> process(@RequestBody @Valid ProcessRequest req) {
    log.info("catalog.process imageId={}", req.getImageId());
    return ResponseEntity.ok(imageCatalogService.processAndStore(req.getImageId()));
  }

  // ------------------------------------------------------------
  // /catalog/process/{imageId}
  // ------------------------------------------------------------
  @GetMapping(path = "/process/{imageId}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ProcessedImageRecord> getProcessed(
      @PathVariable("imageId") String imageId) {
    return imageCatalogService
        .findProcessed(imageId)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  // ------------------------------------------------------------
  // /catalog/quality-test
  // ------------------------------------------------------------
  @PostMapping(
      path = "/quality-test",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<QualityTestResponse> runQualityTest(
      @RequestBody @Valid QualityTestRequest req) {
    String type = req.getTestType().trim().toLowerCase(Locale.ROOT);
    log.info("catalog.qualityTest type={} testCaseId={}", type, req.getTestCaseId());

    switch (type) {
      case TEST_TYPE_FULL:
        QualityReport report = qualityValidator.runFullValidation();
        return ResponseEntity.ok(
            QualityTestResponse.builder()
                .testType(TEST_TYPE_FULL)
                .report(report)
                .summary(Summary.of(report))
                .build());
      case TEST_TYPE_SINGLE:
        if (req.getTestCaseId() == null || req.getTestCaseId().isBlank()) {
          throw new IllegalArgumentException("testCaseId is required for a single test");
        }
        ValidationResult result = qualityValidator.validateTestCase(req.getTestCaseId());
        return ResponseEntity.ok(
            QualityTestResponse.builder().testType(TEST_TYPE_SINGLE).result(result).build());
      default:
        throw new IllegalArgumentException(
            "Invalid testType '" + req.getTestType() + "', expected 'full' or 'single'");
    }
  }

  // ------------------------------------------------------------
  // /catalog/quality-test/history
  // ------------------------------------------------------------
  @GetMapping(path = "/quality-test/history", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<QualityReport>> history(
      @RequestParam(name = "limit", required = false) @Min(1) @Max(100) Integer limit) {
    return ResponseEntity.ok(qualityValidator.getValidationHistory(limit));
  }

  // ------------------------------------------------------------
  // /catalog/quality-test/test-cases
  // ------------------------------------------------------------
  @GetMapping(path = "/quality-test/test-cases", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<TestCase>> testCases() {
    return ResponseEntity.ok(qualityValidator.getTestCases());
  }

  @PutMapping(
      path = "/quality-test/test-cases",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<TestCase> putTestCase(@RequestBody @Valid TestCase testCase) {
    log.info("catalog.testCase.put id={}", testCase.getId());
    return ResponseEntity.ok(qualityValidator.addTestCase(testCase));
  }

  // ------------------------------------------------------------
  // /catalog/quality-test/results/{testCaseId}
  // ------------------------------------------------------------
  @GetMapping(
      path = "/quality-test/results/{testCaseId}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<ValidationResult>> results(
      @PathVariable("testCaseId") String testCaseId,
      @RequestParam(name = "limit", required = false) @Min(1) @Max(100) Integer limit) {
    return ResponseEntity.ok(qualityValidator.getTestCaseResults(testCaseId, limit));
  }

  // ---------- DTOs ----------

  @Data
  public static class ProcessRequest {
    @NotBlank private String imageId;
  }

  @Data
  public static class QualityTestRequest {
    /** {@code full} or {@code single}. */
    @NotBlank private String testType;

    private String testCaseId;
  }

  @Value
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class QualityTestResponse {
    String testType;
    QualityReport report;
    Summary summary;
    ValidationResult result;
  }

  @Value
  public static class Summary {
    int totalTests;
    int passedTests;
    double passRate;
    double averageScore;

    static Summary of(QualityReport report) {
      double passRate =
          report.getTotalTests() == 0
              ? 0.0
              : (double) report.getPassedTests() / report.getTotalTests();
      return new Summary(
          report.getTotalTests(), report.getPassedTests(), passRate, report.getAverageScore());
    }
  }
}
