package com.cario.catalog.app.repository.dynamodb;

import com.cario.catalog.app.model.OrchestrationResult;
import com.cario.catalog.app.model.ProcessedImageRecord;
import com.cario.catalog.app.repository.ResultSink;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.enhanced.dynamodb.*;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/** Repository over the Enhanced DynamoDB table for {@link ProcessedImageItem}. */
@Log4j2
public class ProcessedImageRepository implements ResultSink {

  private final DynamoDbTable<ProcessedImageItem> table;
  private final Clock clock;

  public ProcessedImageRepository(DynamoDbClient ddb, String tableName) {
    this(
        DynamoDbEnhancedClient.builder()
            .dynamoDbClient(ddb)
            .build()
            .table(tableName, TableSchema.fromBean(ProcessedImageItem.class)),
        Clock.systemUTC());
  }

  ProcessedImageRepository(DynamoDbTable<ProcessedImageItem> table, Clock clock) {
    this.table = Objects.requireNonNull(table);
    this.clock = Objects.requireNonNull(clock);
  }

  /** Upsert (blind put) keyed by image id. */
  @Override
  public void save(String imageId, String imageUri, OrchestrationResult result) {
    Objects.requireNonNull(imageId, "imageId");
    Objects.requireNonNull(result, "result");
    ProcessedImageRecord record =
        ProcessedImageRecord.from(imageId, imageUri, result, Instant.now(clock));
    table.putItem(ProcessedImageItem.fromRecord(record));
    log.info(
        "processedImage.save imageId={} method={} confidence={} success={}",
        imageId,
        record.getMethod(),
        String.format("%.2f", record.getConfidence()),
        record.isSuccess());
  }

  public Optional<ProcessedImageRecord> find(String imageId) {
    if (imageId == null) return Optional.empty();
    ProcessedImageItem item = table.getItem(Key.builder().partitionValue(imageId).build());
    return Optional.ofNullable(item).map(ProcessedImageItem::toRecord);
  }
}
