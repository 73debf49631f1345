package com.cario.catalog.app.config;

import com.cario.catalog.app.repository.dynamodb.ProcessedImageRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * AWS configuration for the local environment.
 *
 * <p>Uses static credentials from the application properties. Defines the clients for the image
 * bucket and the processed-image table:
 *
 * <ul>
 *   <li>{@link S3Client} - images and prompt documents.
 *   <li>{@link DynamoDbClient} - one processed result per image id.
 * </ul>
 *
 * <p>Active only when the {@code local} Spring profile is enabled.
 */
@Configuration
@Profile("local")
@Import({ServiceConfig.class, ChatGptConfig.class, SchedulerConfig.class})
public class AwsLocalConfig {

  @Value("${aws.region}")
  private String region;

  @Value("${aws.accessKeyId}")
  private String accessKeyId;

  @Value("${aws.secretAccessKey}")
  private String secretAccessKey;

  @Value("${catalog.dynamodb.table:ProcessedImages}")
  private String tableName;

  @Bean
  StaticCredentialsProvider awsCreds() {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(accessKeyId, secretAccessKey));
  }

  @Bean
  public S3Client s3Client(StaticCredentialsProvider awsCreds) {
    return S3Client.builder().region(Region.of(region)).credentialsProvider(awsCreds).build();
  }

  @Bean
  public DynamoDbClient dynamoDbClient(StaticCredentialsProvider awsCreds) {
    return DynamoDbClient.builder().region(Region.of(region)).credentialsProvider(awsCreds).build();
  }

  @Bean
  public ProcessedImageRepository processedImageRepository(DynamoDbClient ddb) {
    return new ProcessedImageRepository(ddb, tableName);
  }
}
