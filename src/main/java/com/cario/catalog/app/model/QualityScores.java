package com.cario.catalog.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-call diagnostics attached to an orchestration result. OCR fields stay null when the OCR
 * path produced nothing; {@code textOverlapRatio} is only set when both paths returned text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QualityScores {

  private Double bestOcrConfidence;
  private Integer ocrTextLength;
  private Integer ocrMethodsAttempted;

  private Double aiConfidence;
  private Integer aiTextLength;
  private Integer aiObjectsDetected;

  private Double finalConfidence;
  private Integer finalTextLength;

  /** Jaccard similarity of the word sets (words longer than 2 chars) of both texts. */
  private Double textOverlapRatio;
}
