package com.cario.catalog.app.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Externally visible result of one dual-path processing call. Always fully populated. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrchestrationResult {

  private String finalText;
  private String finalDescription;
  private List<String> finalObjects;
  private double finalConfidence;
  private String method;
  private ProcessingDetails processingDetails;
  private long processingTimeMs;
  private boolean success;

  /** Human readable failure description; null on success. */
  private String error;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ProcessingDetails {
    private List<ExtractionResult> ocrResults;
    private VisionResult visionResult;
    private String mergeStrategy;
    private QualityScores qualityScores;
    private ImageQuality imageQuality;
  }
}
