package com.cario.catalog.app.service.pipeline;

import com.cario.catalog.app.model.ExtractionResult;
import com.cario.catalog.app.model.MergeStrategy;
import com.cario.catalog.app.model.MergedResult;
import com.cario.catalog.app.model.VisionResult;
import com.cario.catalog.app.util.TextUtils;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciles the best OCR candidate with the vision result under a {@link MergeStrategy}.
 *
 * <p>On {@code best_confidence} the vision result needs a strictly higher confidence than OCR to
 * win, so an exact tie goes to OCR when OCR clears the threshold. Every returned confidence is
 * clamped to [0.1, 0.95].
 */
public final class ResultMerger {

  public static final double MIN_CONFIDENCE = 0.1;
  public static final double MAX_CONFIDENCE = 0.95;

  static final String METHOD_AI_PRIMARY = "ai_vision_primary";
  static final String METHOD_OCR_PRIMARY = "ocr_primary";
  static final String METHOD_MERGED = "merged_ocr_ai";
  static final String METHOD_AI_ONLY = "ai_only";
  static final String METHOD_OCR_ONLY = "ocr_only";
  static final String METHOD_OCR_FAILED = "ocr_failed";

  static final String STRATEGY_BEST_AI = "best_confidence_ai";
  static final String STRATEGY_BEST_OCR = "best_confidence_ocr";
  static final String STRATEGY_LOW_CONFIDENCE = "low_confidence_merge";
  static final String STRATEGY_COMPREHENSIVE = "comprehensive_merge";
  static final String STRATEGY_AI_ONLY = "ai_only";
  static final String STRATEGY_OCR_ONLY = "ocr_only";
  static final String STRATEGY_OCR_ONLY_FAILED = "ocr_only_failed";

  private static final Map<MergeStrategy, MergeRule> RULES;

  static {
    Map<MergeStrategy, MergeRule> rules = new EnumMap<>(MergeStrategy.class);
    rules.put(MergeStrategy.BEST_CONFIDENCE, ResultMerger::bestConfidence);
    rules.put(
        MergeStrategy.MERGE_ALL,
        (ocr, vision, threshold) -> combine(ocr, vision, STRATEGY_COMPREHENSIVE));
    rules.put(MergeStrategy.AI_ONLY, (ocr, vision, threshold) -> aiOnly(vision));
    rules.put(MergeStrategy.OCR_ONLY, (ocr, vision, threshold) -> ocrOnly(ocr));
    RULES = Collections.unmodifiableMap(rules);
  }

  private ResultMerger() {}

  public static MergedResult merge(
      MergeStrategy strategy,
      Optional<ExtractionResult> bestOcr,
      VisionResult vision,
      double threshold) {
    MergeRule rule = RULES.get(strategy);
    if (rule == null) {
      throw new IllegalArgumentException("No merge rule for strategy " + strategy);
    }
    MergedResult merged = rule.merge(bestOcr, vision, threshold);
    return merged.toBuilder().confidence(clamp(merged.getConfidence())).build();
  }

  static MergedResult bestConfidence(
      Optional<ExtractionResult> bestOcr, VisionResult vision, double threshold) {
    double ocrConfidence = bestOcr.map(ExtractionResult::getConfidence).orElse(0.0);
    double aiConfidence = vision.getConfidence();

    if (aiConfidence > ocrConfidence && aiConfidence >= threshold) {
      return MergedResult.builder()
          .text(vision.getExtractedText())
          .description(vision.getDescription())
          .objects(List.copyOf(vision.getDetectedObjects()))
          .confidence(aiConfidence)
          .method(METHOD_AI_PRIMARY)
          .strategy(STRATEGY_BEST_AI)
          .build();
    }
    if (bestOcr.isPresent() && ocrConfidence >= threshold) {
      ExtractionResult ocr = bestOcr.get();
      return MergedResult.builder()
          .text(ocr.getText())
          .description("OCR extraction (" + ocr.getMethod() + "): " + ocr.getText())
          .objects(ObjectKeywordDetector.detect(ocr.getText()))
          .confidence(ocrConfidence)
          .method(METHOD_OCR_PRIMARY)
          .strategy(STRATEGY_BEST_OCR)
          .build();
    }
    return combine(bestOcr, vision, STRATEGY_LOW_CONFIDENCE);
  }

  static MergedResult aiOnly(VisionResult vision) {
    return MergedResult.builder()
        .text(vision.getExtractedText())
        .description(vision.getDescription())
        .objects(List.copyOf(vision.getDetectedObjects()))
        .confidence(vision.getConfidence())
        .method(METHOD_AI_ONLY)
        .strategy(STRATEGY_AI_ONLY)
        .build();
  }

  static MergedResult ocrOnly(Optional<ExtractionResult> bestOcr) {
    if (bestOcr.isEmpty()) {
      return MergedResult.builder()
          .text("")
          .description("No OCR results available")
          .objects(List.of(ObjectKeywordDetector.DEFAULT_OBJECT))
          .confidence(MIN_CONFIDENCE)
          .method(METHOD_OCR_FAILED)
          .strategy(STRATEGY_OCR_ONLY_FAILED)
          .build();
    }
    ExtractionResult ocr = bestOcr.get();
    return MergedResult.builder()
        .text(ocr.getText())
        .description("OCR extraction: " + ocr.getText())
        .objects(ObjectKeywordDetector.detect(ocr.getText()))
        .confidence(ocr.getConfidence())
        .method(METHOD_OCR_ONLY)
        .strategy(STRATEGY_OCR_ONLY)
        .build();
  }

  /** Both sides at once: joined texts, union of objects, averaged confidence. */
  static MergedResult combine(
      Optional<ExtractionResult> bestOcr, VisionResult vision, String strategy) {
    List<String> texts = new ArrayList<>();
    String ocrText = bestOcr.map(ExtractionResult::getText).orElse("");
    if (!ocrText.isBlank()) {
      texts.add("OCR (" + bestOcr.get().getMethod() + "): " + ocrText.trim());
    }
    String aiText = vision.getExtractedText() == null ? "" : vision.getExtractedText();
    if (!aiText.isBlank()) {
      texts.add("AI Vision: " + aiText.trim());
    }

    Set<String> objects = new LinkedHashSet<>();
    bestOcr.ifPresent(ocr -> objects.addAll(ObjectKeywordDetector.detect(ocr.getText())));
    objects.addAll(vision.getDetectedObjects());

    String description = vision.getDescription() == null ? "" : vision.getDescription();
    if (!ocrText.isEmpty() && !description.contains(ocrText)) {
      description = description.isEmpty() ? ocrText : description + " | OCR detected: " + ocrText;
    }
    if (TextUtils.isBlank(description)) {
      description = "Combined OCR and AI analysis results";
    }

    double ocrConfidence = bestOcr.map(ExtractionResult::getConfidence).orElse(0.0);
    double mean = (ocrConfidence + vision.getConfidence()) / 2;

    return MergedResult.builder()
        .text(String.join(" | ", texts))
        .description(description)
        .objects(new ArrayList<>(objects))
        .confidence(Math.max(MIN_CONFIDENCE, mean))
        .method(METHOD_MERGED)
        .strategy(strategy)
        .build();
  }

  static double clamp(double confidence) {
    return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
  }
}
