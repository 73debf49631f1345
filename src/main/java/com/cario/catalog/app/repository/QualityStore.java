package com.cario.catalog.app.repository;

import com.cario.catalog.app.model.QualityReport;
import com.cario.catalog.app.model.TestCase;
import com.cario.catalog.app.model.ValidationResult;
import java.util.List;
import java.util.Optional;

/** Persistence of the validation corpus, per-case results and run reports. */
public interface QualityStore {

  List<TestCase> findAllTestCases();

  Optional<TestCase> findTestCase(String id);

  /** Insert or replace by id. */
  void upsertTestCase(TestCase testCase);

  void saveResult(ValidationResult result);

  /** Newest first. */
  List<ValidationResult> findResultsByTestCase(String testCaseId, int limit);

  /** Appends the report and returns it with its store id. */
  QualityReport saveReport(QualityReport report);

  /** Newest first. */
  List<QualityReport> findRecentReports(int limit);
}
