package com.cario.catalog.app.model;

import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Persisted view of an orchestration result, keyed by image identifier. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedImageRecord {
  private String imageId;
  private String imageUri;
  private String extractedText;
  private String description;
  private List<String> objects;
  private double confidence;
  private String method;
  private String mergeStrategy;
  private boolean success;
  private String error;
  private long processingTimeMs;
  private Instant processedAt;

  public static ProcessedImageRecord from(
      String imageId, String imageUri, OrchestrationResult result, Instant processedAt) {
    String strategy =
        result.getProcessingDetails() == null
            ? null
            : result.getProcessingDetails().getMergeStrategy();
    return ProcessedImageRecord.builder()
        .imageId(imageId)
        .imageUri(imageUri)
        .extractedText(result.getFinalText())
        .description(result.getFinalDescription())
        .objects(result.getFinalObjects())
        .confidence(result.getFinalConfidence())
        .method(result.getMethod())
        .mergeStrategy(strategy)
        .success(result.isSuccess())
        .error(result.getError())
        .processingTimeMs(result.getProcessingTimeMs())
        .processedAt(processedAt)
        .build();
  }
}
