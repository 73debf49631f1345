package com.cario.catalog.app.service.pipeline;

import com.cario.catalog.app.model.ExtractionResult;
import com.cario.catalog.app.model.MergedResult;
import com.cario.catalog.app.model.QualityScores;
import com.cario.catalog.app.model.VisionResult;
import com.cario.catalog.app.util.TextUtils;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

final class QualityScoreCalculator {

  private QualityScoreCalculator() {}

  static QualityScores calculate(
      List<ExtractionResult> ocrResults,
      Optional<ExtractionResult> bestOcr,
      VisionResult vision,
      MergedResult merged) {
    QualityScores.QualityScoresBuilder scores =
        QualityScores.builder()
            .aiConfidence(vision.getConfidence())
            .aiTextLength(vision.getExtractedText().length())
            .aiObjectsDetected(vision.getDetectedObjects().size())
            .finalConfidence(merged.getConfidence())
            .finalTextLength(merged.getText().length());

    bestOcr.ifPresent(
        best ->
            scores
                .bestOcrConfidence(best.getConfidence())
                .ocrTextLength(best.getText().length())
                .ocrMethodsAttempted(ocrResults.size()));

    if (bestOcr.isPresent() && !TextUtils.isBlank(vision.getExtractedText())) {
      scores.textOverlapRatio(jaccard(bestOcr.get().getText(), vision.getExtractedText()));
    }
    return scores.build();
  }

  static double jaccard(String a, String b) {
    Set<String> left = TextUtils.significantWords(a);
    Set<String> right = TextUtils.significantWords(b);
    Set<String> union = new HashSet<>(left);
    union.addAll(right);
    if (union.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(left);
    intersection.retainAll(right);
    return (double) intersection.size() / union.size();
  }
}
