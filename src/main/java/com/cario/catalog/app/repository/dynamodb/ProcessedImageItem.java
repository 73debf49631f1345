package com.cario.catalog.app.repository.dynamodb;

import com.cario.catalog.app.model.ProcessedImageRecord;
import java.time.Instant;
import java.util.List;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/** One processed image. Re-processing the same image id overwrites the previous item. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class ProcessedImageItem {

  /** Partition key: the image identifier used by the resolver. */
  private String imageId;

  /** {@code s3://...} or {@code file:...} location the image was read from. */
  private String imageUri;

  private String extractedText;
  private String description;
  private List<String> objects;
  private Double confidence;

  /** Contributing path(s), e.g. ai_vision_primary, merged_ocr_ai, error. */
  private String method;

  private String mergeStrategy;
  private Boolean success;
  private String error;
  private Long processingTimeMs;
  private Instant processedAt;

  // ---------- DynamoDB mapping ----------

  @DynamoDbPartitionKey
  @DynamoDbAttribute("imageId")
  public String getImageId() {
    return imageId;
  }

  @DynamoDbAttribute("imageUri")
  public String getImageUri() {
    return imageUri;
  }

  @DynamoDbAttribute("extractedText")
  public String getExtractedText() {
    return extractedText;
  }

  @DynamoDbAttribute("description")
  public String getDescription() {
    return description;
  }

  @DynamoDbAttribute("objects")
  public List<String> getObjects() {
    return objects;
  }

  @DynamoDbAttribute("confidence")
  public Double getConfidence() {
    return confidence;
  }

  @DynamoDbAttribute("method")
  public String getMethod() {
    return method;
  }

  @DynamoDbAttribute("mergeStrategy")
  public String getMergeStrategy() {
    return mergeStrategy;
  }

  @DynamoDbAttribute("success")
  public Boolean getSuccess() {
    return success;
  }

  @DynamoDbAttribute("error")
  public String getError() {
    return error;
  }

  @DynamoDbAttribute("processingTimeMs")
  public Long getProcessingTimeMs() {
    return processingTimeMs;
  }

  @DynamoDbAttribute("processedAt")
  public Instant getProcessedAt() {
    return processedAt;
  }

  static ProcessedImageItem fromRecord(ProcessedImageRecord r) {
    return ProcessedImageItem.builder()
        .imageId(r.getImageId())
        .imageUri(r.getImageUri())
        .extractedText(r.getExtractedText())
        .description(r.getDescription())
        .objects(r.getObjects())
        .confidence(r.getConfidence())
        .method(r.getMethod())
        .mergeStrategy(r.getMergeStrategy())
        .success(r.isSuccess())
        .error(r.getError())
        .processingTimeMs(r.getProcessingTimeMs())
        .processedAt(r.getProcessedAt())
        .build();
  }

  ProcessedImageRecord toRecord() {
    return ProcessedImageRecord.builder()
        .imageId(imageId)
        .imageUri(imageUri)
        .extractedText(extractedText)
        .description(description)
        .objects(objects == null ? List.of() : objects)
        .confidence(confidence == null ? 0.0 : confidence)
        .method(method)
        .mergeStrategy(mergeStrategy)
        .success(Boolean.TRUE.equals(success))
        .error(error)
        .processingTimeMs(processingTimeMs == null ? 0L : processingTimeMs)
        .processedAt(processedAt)
        .build();
  }
}
