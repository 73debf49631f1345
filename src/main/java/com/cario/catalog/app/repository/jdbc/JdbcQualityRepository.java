package com.cario.catalog.app.repository.jdbc;

import com.cario.catalog.app.model.QualityReport;
import com.cario.catalog.app.model.TestCase;
import com.cario.catalog.app.model.ValidationResult;
import com.cario.catalog.app.repository.QualityStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

/**
 * {@link QualityStore} over three relational tables (see {@code schema.sql}). List and map
 * columns are stored as JSON text.
 */
@Log4j2
public class JdbcQualityRepository implements QualityStore {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<Map<String, Integer>> COUNT_MAP = new TypeReference<>() {};

  static final String UPSERT_TEST_CASE =
      "INSERT INTO quality_test_cases (id, image_reference, expected_text_fragments,"
          + " expected_object_labels, min_confidence, category, description, updated_at)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)"
          + " ON CONFLICT (id) DO UPDATE SET image_reference = EXCLUDED.image_reference,"
          + " expected_text_fragments = EXCLUDED.expected_text_fragments,"
          + " expected_object_labels = EXCLUDED.expected_object_labels,"
          + " min_confidence = EXCLUDED.min_confidence, category = EXCLUDED.category,"
          + " description = EXCLUDED.description, updated_at = EXCLUDED.updated_at";

  static final String INSERT_RESULT =
      "INSERT INTO quality_validation_results (test_case_id, passed, score, text_accuracy,"
          + " object_accuracy, confidence_score, processing_time_ms, method, issues,"
          + " recommendations, validated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

  static final String INSERT_REPORT =
      "INSERT INTO quality_reports (total_tests, passed_tests, average_score,"
          + " average_processing_time_ms, method_breakdown, category_breakdown, common_issues,"
          + " recommendations, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

  private static final String TEST_CASE_COLUMNS =
      "id, image_reference, expected_text_fragments, expected_object_labels, min_confidence,"
          + " category, description";

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper om = new ObjectMapper();

  public JdbcQualityRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  // -------- Test cases --------

  @Override
  public List<TestCase> findAllTestCases() {
    return jdbcTemplate.query(
        "SELECT " + TEST_CASE_COLUMNS + " FROM quality_test_cases ORDER BY id", testCaseMapper());
  }

  @Override
  public Optional<TestCase> findTestCase(String id) {
    List<TestCase> rows =
        jdbcTemplate.query(
            "SELECT " + TEST_CASE_COLUMNS + " FROM quality_test_cases WHERE id = ?",
            testCaseMapper(),
            id);
    return rows.stream().findFirst();
  }

  @Override
  public void upsertTestCase(TestCase tc) {
    jdbcTemplate.update(
        UPSERT_TEST_CASE,
        tc.getId(),
        tc.getImageReference(),
        toJson(tc.getExpectedTextFragments()),
        toJson(tc.getExpectedObjectLabels()),
        tc.getMinConfidence(),
        tc.getCategory(),
        tc.getDescription(),
        Timestamp.from(Instant.now()));
    log.info("quality.testCase.upsert id={} category={}", tc.getId(), tc.getCategory());
  }

  // -------- Results --------

  @Override
  public void saveResult(ValidationResult r) {
    ValidationResult.Details d = r.getDetails();
    jdbcTemplate.update(
        INSERT_RESULT,
        r.getTestCaseId(),
        r.isPassed(),
        r.getScore(),
        d == null ? null : d.getTextAccuracy(),
        d == null ? null : d.getObjectAccuracy(),
        d == null ? null : d.getConfidenceScore(),
        d == null ? null : d.getProcessingTimeMs(),
        d == null ? null : d.getMethod(),
        toJson(r.getIssues()),
        toJson(r.getRecommendations()),
        Timestamp.from(r.getValidatedAt() == null ? Instant.now() : r.getValidatedAt()));
  }

  @Override
  public List<ValidationResult> findResultsByTestCase(String testCaseId, int limit) {
    return jdbcTemplate.query(
        "SELECT * FROM quality_validation_results WHERE test_case_id = ?"
            + " ORDER BY validated_at DESC, id DESC LIMIT ?",
        resultMapper(),
        testCaseId,
        limit);
  }

  // -------- Reports --------

  @Override
  public QualityReport saveReport(QualityReport report) {
    KeyHolder keys = new GeneratedKeyHolder();
    Instant timestamp = report.getTimestamp() == null ? Instant.now() : report.getTimestamp();
    jdbcTemplate.update(
        con -> {
          PreparedStatement ps = con.prepareStatement(INSERT_REPORT, new String[] {"id"});
          ps.setInt(1, report.getTotalTests());
          ps.setInt(2, report.getPassedTests());
          ps.setDouble(3, report.getAverageScore());
          ps.setDouble(4, report.getAverageProcessingTimeMs());
          ps.setString(5, toJson(report.getMethodBreakdown()));
          ps.setString(6, toJson(report.getCategoryBreakdown()));
          ps.setString(7, toJson(report.getCommonIssues()));
          ps.setString(8, toJson(report.getRecommendations()));
          ps.setTimestamp(9, Timestamp.from(timestamp));
          return ps;
        },
        keys);
    Number id = keys.getKey();
    report.setId(id == null ? null : id.longValue());
    report.setTimestamp(timestamp);
    log.info(
        "quality.report.saved id={} total={} passed={}",
        report.getId(),
        report.getTotalTests(),
        report.getPassedTests());
    return report;
  }

  @Override
  public List<QualityReport> findRecentReports(int limit) {
    return jdbcTemplate.query(
        "SELECT * FROM quality_reports ORDER BY created_at DESC, id DESC LIMIT ?",
        reportMapper(),
        limit);
  }

  // -------- Row mappers --------

  RowMapper<TestCase> testCaseMapper() {
    return (rs, rowNum) ->
        TestCase.builder()
            .id(rs.getString("id"))
            .imageReference(rs.getString("image_reference"))
            .expectedTextFragments(toList(rs.getString("expected_text_fragments")))
            .expectedObjectLabels(toList(rs.getString("expected_object_labels")))
            .minConfidence(nullableDouble(rs, "min_confidence"))
            .category(rs.getString("category"))
            .description(rs.getString("description"))
            .build();
  }

  RowMapper<ValidationResult> resultMapper() {
    return (rs, rowNum) ->
        ValidationResult.builder()
            .testCaseId(rs.getString("test_case_id"))
            .passed(rs.getBoolean("passed"))
            .score(rs.getDouble("score"))
            .details(
                ValidationResult.Details.builder()
                    .textAccuracy(rs.getDouble("text_accuracy"))
                    .objectAccuracy(rs.getDouble("object_accuracy"))
                    .confidenceScore(rs.getDouble("confidence_score"))
                    .processingTimeMs(rs.getLong("processing_time_ms"))
                    .method(rs.getString("method"))
                    .build())
            .issues(toList(rs.getString("issues")))
            .recommendations(toList(rs.getString("recommendations")))
            .validatedAt(toInstant(rs.getTimestamp("validated_at")))
            .build();
  }

  RowMapper<QualityReport> reportMapper() {
    return (rs, rowNum) ->
        QualityReport.builder()
            .id(rs.getLong("id"))
            .totalTests(rs.getInt("total_tests"))
            .passedTests(rs.getInt("passed_tests"))
            .averageScore(rs.getDouble("average_score"))
            .averageProcessingTimeMs(rs.getDouble("average_processing_time_ms"))
            .methodBreakdown(toCountMap(rs.getString("method_breakdown")))
            .categoryBreakdown(toCountMap(rs.getString("category_breakdown")))
            .commonIssues(toList(rs.getString("common_issues")))
            .recommendations(toList(rs.getString("recommendations")))
            .timestamp(toInstant(rs.getTimestamp("created_at")))
            .build();
  }

  // -------- Internals --------

  private String toJson(Object value) {
    if (value == null) return null;
    try {
      return om.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialise " + value.getClass().getSimpleName(), e);
    }
  }

  private List<String> toList(String json) {
    return json == null || json.isBlank() ? List.of() : fromJson(json, STRING_LIST);
  }

  private Map<String, Integer> toCountMap(String json) {
    return json == null || json.isBlank() ? Map.of() : fromJson(json, COUNT_MAP);
  }

  private <T> T fromJson(String json, TypeReference<T> type) {
    try {
      return om.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt JSON column value: " + json, e);
    }
  }

  private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }

  private static Instant toInstant(Timestamp ts) {
    return ts == null ? null : ts.toInstant();
  }
}
