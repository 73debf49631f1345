package com.cario.catalog.app.service.ocr;

import com.cario.catalog.app.exception.OcrEngineUnavailableException;
import com.cario.catalog.app.exception.OcrProcessingException;
import com.cario.catalog.app.model.ExtractionResult;
import com.cario.catalog.app.model.OcrStrategy;
import com.cario.catalog.app.service.image.ImagePreprocessor;
import com.cario.catalog.app.service.image.PreprocessedImage;
import com.cario.catalog.app.util.TextUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Runs the OCR engine once per {@link OcrStrategy}, sequentially, and scores every result.
 *
 * <ol>
 *   <li>Preprocess the source image with the strategy's steps (skipped when it has none).
 *   <li>Recognise text with the strategy's engine parameters.
 *   <li>Score the raw text with {@link OcrConfidenceScorer}.
 *   <li>Delete the derived image, whatever happened.
 * </ol>
 *
 * A strategy that fails is left out of the result list. The call only fails when no strategy
 * produced anything.
 */
@Log4j2
public class MultiStrategyOcrRunner {

  /** Confidence gap under which the longer text wins. */
  static final double CONFIDENCE_MARGIN = 0.1;

  private final OcrEngine engine;
  private final ImagePreprocessor preprocessor;
  private final List<OcrStrategy> strategies;

  public MultiStrategyOcrRunner(
      OcrEngine engine, ImagePreprocessor preprocessor, List<OcrStrategy> strategies) {
    this.engine = Objects.requireNonNull(engine);
    this.preprocessor = Objects.requireNonNull(preprocessor);
    if (strategies == null || strategies.isEmpty()) {
      throw new IllegalArgumentException("At least one OCR strategy is required");
    }
    this.strategies = List.copyOf(strategies);
  }

  public List<OcrStrategy> getStrategies() {
    return strategies;
  }

  /**
   * @return one result per successful strategy, in table order
   * @throws OcrEngineUnavailableException if every strategy failed and at least one failure was
   *     the engine being unavailable
   * @throws OcrProcessingException if every strategy failed otherwise
   */
  public List<ExtractionResult> runAll(Path image) {
    List<ExtractionResult> results = new ArrayList<>();
    List<String> failures = new ArrayList<>();
    boolean engineUnavailable = false;

    for (OcrStrategy strategy : strategies) {
      long t0 = System.nanoTime();
      try {
        ExtractionResult result = runStrategy(image, strategy);
        results.add(result);
        log.info(
            "ocr.strategy.ok name={} confidence={} length={} durationMs={} text=\"{}\"",
            strategy.getName(),
            String.format("%.2f", result.getConfidence()),
            result.getText().length(),
            (System.nanoTime() - t0) / 1_000_000,
            TextUtils.truncate(result.getText(), 50));
      } catch (OcrEngineUnavailableException e) {
        engineUnavailable = true;
        failures.add(strategy.getName() + ": " + e.getMessage());
        log.warn("ocr.strategy.unavailable name={} msg={}", strategy.getName(), e.getMessage());
      } catch (RuntimeException e) {
        failures.add(strategy.getName() + ": " + e.getMessage());
        log.warn("ocr.strategy.failed name={} msg={}", strategy.getName(), e.getMessage());
      }
    }

    if (results.isEmpty()) {
      String message = "All OCR strategies failed: " + String.join("; ", failures);
      log.error("ocr.allFailed image={} engineUnavailable={}", image, engineUnavailable);
      if (engineUnavailable) {
        throw new OcrEngineUnavailableException(message);
      }
      throw new OcrProcessingException(message);
    }
    return results;
  }

  private ExtractionResult runStrategy(Path image, OcrStrategy strategy) {
    List<String> steps = strategy.getPreprocessingSteps();
    PreprocessedImage derived = null;
    try {
      Path input = image;
      List<String> notes = List.of();
      if (steps != null && !steps.isEmpty()) {
        derived = preprocessor.apply(image, steps);
        input = derived.getPath();
        notes = derived.getNotes();
      }

      String raw = engine.recognize(input, strategy.getParams());
      String text = raw == null ? "" : raw;
      return ExtractionResult.builder()
          .text(text.trim())
          .confidence(OcrConfidenceScorer.score(text, strategy.getName()))
          .method(strategy.getName())
          .preprocessingApplied(steps == null ? List.of() : List.copyOf(steps))
          .preprocessingNotes(List.copyOf(notes))
          .build();
    } finally {
      if (derived != null) {
        deleteDerived(derived.getPath());
      }
    }
  }

  private static void deleteDerived(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("ocr.cleanup.failed path={} msg={}", path, e.getMessage());
    }
  }

  /**
   * Picks the most useful candidate: a clearly higher confidence wins, otherwise the longer text.
   * On a full tie the earlier candidate is kept.
   *
   * @throws IllegalArgumentException when {@code results} is empty
   */
  public static ExtractionResult selectBest(List<ExtractionResult> results) {
    if (results == null || results.isEmpty()) {
      throw new IllegalArgumentException("No OCR results to select from");
    }
    ExtractionResult best = results.get(0);
    for (int i = 1; i < results.size(); i++) {
      if (beats(results.get(i), best)) {
        best = results.get(i);
      }
    }
    return best;
  }

  private static boolean beats(ExtractionResult candidate, ExtractionResult current) {
    double diff = candidate.getConfidence() - current.getConfidence();
    if (Math.abs(diff) > CONFIDENCE_MARGIN) {
      return diff > 0;
    }
    return candidate.getText().length() > current.getText().length();
  }
}
