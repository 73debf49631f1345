package com.cario.catalog.app.config;

import com.cario.catalog.app.repository.dynamodb.ProcessedImageRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * AWS configuration for the production profile. Credentials come from the default provider
 * chain (instance role, environment, profile file).
 */
@Configuration
@Profile("production")
@Import({ServiceConfig.class, ChatGptConfig.class, SchedulerConfig.class})
public class AwsProdConfig {

  /** Region for every client, from {@code aws.region}. */
  @Value("${aws.region}")
  private String region;

  @Value("${catalog.dynamodb.table:ProcessedImages}")
  private String tableName;

  @Bean
  public S3Client s3Client() {
    return S3Client.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean
  public DynamoDbClient dynamoDbClient() {
    return DynamoDbClient.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean
  public ProcessedImageRepository processedImageRepository(DynamoDbClient ddb) {
    return new ProcessedImageRepository(ddb, tableName);
  }
}
