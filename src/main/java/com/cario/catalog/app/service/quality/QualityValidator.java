package com.cario.catalog.app.service.quality;

import com.cario.catalog.app.exception.TestCaseNotFoundException;
import com.cario.catalog.app.model.OrchestrationResult;
import com.cario.catalog.app.model.QualityReport;
import com.cario.catalog.app.model.TestCase;
import com.cario.catalog.app.model.ValidationResult;
import com.cario.catalog.app.repository.QualityStore;
import com.cario.catalog.app.service.pipeline.DualPathOrchestrator;
import com.cario.catalog.app.service.storage.ImageResolver;
import com.cario.catalog.app.service.storage.ResolvedImage;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;

/**
 * Regression harness: runs labeled images through the orchestrator and scores the output.
 *
 * <p>Score = 0.4 text accuracy + 0.3 object accuracy + 0.3 confidence score. A case passes with a
 * score of at least 0.7 and a final confidence at or above its minimum. Cases that cannot be
 * processed score 0 instead of failing the run.
 */
@Log4j2
public class QualityValidator {

  static final double PASS_SCORE = 0.7;
  static final double ACCURACY_WARNING = 0.7;
  static final int DEFAULT_HISTORY_LIMIT = 10;
  static final int DEFAULT_RESULTS_LIMIT = 5;

  static final String LOW_TEXT_ACCURACY = "Low text extraction accuracy";
  static final String POOR_OBJECT_DETECTION = "Poor object detection";
  static final String LOW_CONFIDENCE = "Confidence below threshold";

  private final DualPathOrchestrator orchestrator;
  private final ImageResolver imageResolver;
  private final QualityStore store;
  private final Clock clock;

  private volatile boolean initialized;

  public QualityValidator(
      DualPathOrchestrator orchestrator,
      ImageResolver imageResolver,
      QualityStore store,
      Clock clock) {
    this.orchestrator = Objects.requireNonNull(orchestrator);
    this.imageResolver = Objects.requireNonNull(imageResolver);
    this.store = Objects.requireNonNull(store);
    this.clock = Objects.requireNonNull(clock);
  }

  // -------- Corpus --------

  /** Loads the corpus, seeding the default cases when the store is empty. */
  public synchronized List<TestCase> initializeTestCases() {
    List<TestCase> existing = store.findAllTestCases();
    if (existing.isEmpty()) {
      defaultTestCases().forEach(store::upsertTestCase);
      existing = store.findAllTestCases();
      log.info("quality.init seeded={}", existing.size());
    } else {
      log.info("quality.init loaded={}", existing.size());
    }
    initialized = true;
    return existing;
  }

  public List<TestCase> getTestCases() {
    if (!initialized) {
      return initializeTestCases();
    }
    return store.findAllTestCases();
  }

  /** Insert or replace a case by id, with defaults applied. */
  public TestCase addTestCase(TestCase testCase) {
    TestCase normalized = testCase.withDefaults();
    store.upsertTestCase(normalized);
    log.info(
        "quality.testCase.added id={} category={}", normalized.getId(), normalized.getCategory());
    return normalized;
  }

  // -------- Validation --------

  /** Validates a stored case by id and records the result. */
  public ValidationResult validateTestCase(String testCaseId) {
    getTestCases();
    TestCase testCase =
        store.findTestCase(testCaseId).orElseThrow(() -> new TestCaseNotFoundException(testCaseId));
    ValidationResult result = validateTestCase(testCase);
    store.saveResult(result);
    return result;
  }

  /** Scores one case. Never throws; processing failures become zero-score results. */
  public ValidationResult validateTestCase(TestCase testCase) {
    TestCase tc = testCase.withDefaults();
    try (ResolvedImage image = imageResolver.resolve(tc.getImageReference())) {
      OrchestrationResult result = orchestrator.processImage(image.getPath());
      ValidationResult scored = score(tc, result, Instant.now(clock));
      log.info(
          "quality.case id={} passed={} score={} method={} durationMs={}",
          tc.getId(),
          scored.isPassed(),
          String.format("%.3f", scored.getScore()),
          result.getMethod(),
          result.getProcessingTimeMs());
      return scored;
    } catch (RuntimeException e) {
      log.warn("quality.case.error id={} msg={}", tc.getId(), e.getMessage());
      return errorResult(tc.getId(), e.getMessage(), Instant.now(clock));
    }
  }

  /** Runs every case, stores each result and the report, and returns the report. */
  public QualityReport runFullValidation() {
    String runId = UUID.randomUUID().toString().substring(0, 8);
    long t0 = System.nanoTime();
    List<TestCase> testCases = getTestCases();
    log.info("quality.run.start id={} cases={}", runId, testCases.size());

    List<ValidationResult> results = new ArrayList<>();
    for (TestCase tc : testCases) {
      results.add(validateTestCase(tc));
    }

    QualityReport report = QualityReportGenerator.generate(testCases, results, Instant.now(clock));
    results.forEach(store::saveResult);
    QualityReport saved = store.saveReport(report);

    log.info(
        "quality.run.done id={} passed={}/{} avgScore={} durationMs={}",
        runId,
        saved.getPassedTests(),
        saved.getTotalTests(),
        String.format("%.3f", saved.getAverageScore()),
        (System.nanoTime() - t0) / 1_000_000);
    return saved;
  }

  // -------- History --------

  public List<QualityReport> getValidationHistory(Integer limit) {
    return store.findRecentReports(positiveOr(limit, DEFAULT_HISTORY_LIMIT));
  }

  public List<ValidationResult> getTestCaseResults(String testCaseId, Integer limit) {
    return store.findResultsByTestCase(testCaseId, positiveOr(limit, DEFAULT_RESULTS_LIMIT));
  }

  // -------- Scoring --------

  static ValidationResult score(TestCase tc, OrchestrationResult result, Instant validatedAt) {
    double textAccuracy = textAccuracy(result.getFinalText(), tc.getExpectedTextFragments());
    double objectAccuracy = objectAccuracy(result.getFinalObjects(), tc.getExpectedObjectLabels());
    double finalConfidence = result.getFinalConfidence();
    double minConfidence = tc.getMinConfidence();
    double confidenceScore =
        finalConfidence >= minConfidence ? 1.0 : finalConfidence / minConfidence;

    double score = textAccuracy * 0.4 + objectAccuracy * 0.3 + confidenceScore * 0.3;
    boolean passed = score >= PASS_SCORE && finalConfidence >= minConfidence;

    List<String> issues = new ArrayList<>();
    List<String> recommendations = new ArrayList<>();
    if (textAccuracy < ACCURACY_WARNING) {
      issues.add(LOW_TEXT_ACCURACY);
      recommendations.add("Consider adjusting OCR preprocessing or AI prompt");
    }
    if (objectAccuracy < ACCURACY_WARNING) {
      issues.add(POOR_OBJECT_DETECTION);
      recommendations.add("Improve object detection algorithms or training data");
    }
    if (finalConfidence < minConfidence) {
      issues.add(LOW_CONFIDENCE);
      recommendations.add("Review confidence calculation or adjust thresholds");
    }

    return ValidationResult.builder()
        .testCaseId(tc.getId())
        .passed(passed)
        .score(score)
        .details(
            ValidationResult.Details.builder()
                .textAccuracy(textAccuracy)
                .objectAccuracy(objectAccuracy)
                .confidenceScore(confidenceScore)
                .processingTimeMs(result.getProcessingTimeMs())
                .method(result.getMethod())
                .build())
        .issues(issues)
        .recommendations(recommendations)
        .validatedAt(validatedAt)
        .build();
  }

  static double textAccuracy(String finalText, List<String> expectedFragments) {
    if (expectedFragments == null || expectedFragments.isEmpty()) {
      return 1.0;
    }
    String haystack = finalText == null ? "" : finalText.toLowerCase(Locale.ROOT);
    long found =
        expectedFragments.stream()
            .filter(f -> haystack.contains(f.toLowerCase(Locale.ROOT)))
            .count();
    return (double) found / expectedFragments.size();
  }

  static double objectAccuracy(List<String> finalObjects, List<String> expectedLabels) {
    if (expectedLabels == null || expectedLabels.isEmpty()) {
      return 1.0;
    }
    List<String> objects = finalObjects == null ? List.of() : finalObjects;
    long found =
        expectedLabels.stream()
            .filter(label -> objects.stream().anyMatch(o -> o.equalsIgnoreCase(label)))
            .count();
    return (double) found / expectedLabels.size();
  }

  static ValidationResult errorResult(String testCaseId, String message, Instant validatedAt) {
    return ValidationResult.builder()
        .testCaseId(testCaseId)
        .passed(false)
        .score(0.0)
        .details(ValidationResult.Details.builder().method("error").build())
        .issues(List.of("Processing error: " + message))
        .recommendations(List.of("Fix processing pipeline errors"))
        .validatedAt(validatedAt)
        .build();
  }

  static List<TestCase> defaultTestCases() {
    return List.of(
        TestCase.builder()
            .id("barcode_test")
            .imageReference("test-images/barcode-sample.jpg")
            .expectedTextFragments(List.of("barcode", "upc", "product"))
            .expectedObjectLabels(List.of("product", "labeled_product"))
            .minConfidence(0.8)
            .category("barcode")
            .description("Standard barcode detection test")
            .build(),
        TestCase.builder()
            .id("text_label_test")
            .imageReference("test-images/text-label-sample.jpg")
            .expectedTextFragments(List.of("model", "part", "number"))
            .expectedObjectLabels(List.of("product", "labeled_product"))
            .minConfidence(0.7)
            .category("text_extraction")
            .description("Product label text extraction test")
            .build(),
        TestCase.builder()
            .id("electronics_test")
            .imageReference("test-images/electronics-sample.jpg")
            .expectedTextFragments(List.of("electronic", "device", "voltage"))
            .expectedObjectLabels(List.of("electronics", "product"))
            .minConfidence(0.6)
            .category("electronics")
            .description("Electronics product identification test")
            .build());
  }

  private static int positiveOr(Integer value, int fallback) {
    return value == null || value <= 0 ? fallback : value;
  }
}
