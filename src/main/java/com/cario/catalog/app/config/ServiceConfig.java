package com.cario.catalog.app.config;

import com.cario.catalog.app.prompt.PromptConfig;
import com.cario.catalog.app.repository.QualityStore;
import com.cario.catalog.app.repository.dynamodb.ProcessedImageRepository;
import com.cario.catalog.app.repository.jdbc.JdbcQualityRepository;
import com.cario.catalog.app.service.image.ImageCompressor;
import com.cario.catalog.app.service.image.ImagePreprocessor;
import com.cario.catalog.app.service.image.ImageQualityAnalyzer;
import com.cario.catalog.app.service.image.OpenCvImageCompressor;
import com.cario.catalog.app.service.image.OpenCvImagePreprocessor;
import com.cario.catalog.app.service.ocr.MultiStrategyOcrRunner;
import com.cario.catalog.app.service.ocr.OcrEngine;
import com.cario.catalog.app.service.ocr.OcrStrategies;
import com.cario.catalog.app.service.ocr.TesseractOcrEngine;
import com.cario.catalog.app.service.pipeline.DualPathOrchestrator;
import com.cario.catalog.app.service.pipeline.ImageCatalogService;
import com.cario.catalog.app.service.quality.QualityValidator;
import com.cario.catalog.app.service.storage.ImageResolver;
import com.cario.catalog.app.service.storage.LocalImageResolver;
import com.cario.catalog.app.service.storage.S3ImageResolver;
import com.cario.catalog.app.service.vision.PromptLoaderService;
import com.cario.catalog.app.service.vision.SpringAiVisionClient;
import com.cario.catalog.app.service.vision.VisionClient;
import com.cario.catalog.app.service.vision.VisionExtractor;
import java.nio.file.Path;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import software.amazon.awssdk.services.s3.S3Client;

@Log4j2
@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final S3Client s3Client;
  private final ChatClient.Builder chatClientBuilder;
  private final ProcessedImageRepository processedImageRepository;
  private final JdbcTemplate jdbcTemplate;
  private final CatalogProperties props;

  // -------------------
  // Utility
  // -------------------

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PromptLoaderService promptLoaderService() {
    return new PromptLoaderService(s3Client);
  }

  /** Vision prompt from S3 when {@code catalog.vision.prompt-bucket} is set, else the classpath. */
  @Bean
  public PromptConfig visionPrompt(PromptLoaderService promptLoaderService) {
    CatalogProperties.Vision vision = props.getVision();
    if (!vision.getPromptBucket().isBlank()) {
      return promptLoaderService.load(vision.getPromptBucket(), vision.getPromptKey());
    }
    return promptLoaderService.loadClasspath(vision.getPromptResource());
  }

  // -------------------
  // Image + OCR
  // -------------------

  @Bean
  public ImagePreprocessor imagePreprocessor() {
    CatalogProperties.Ocr ocr = props.getOcr();
    return new OpenCvImagePreprocessor(ocr.getUpscaleTargetPx(), ocr.getMaxUpscaleFactor());
  }

  @Bean
  public ImageCompressor imageCompressor() {
    return new OpenCvImageCompressor();
  }

  @Bean
  public ImageQualityAnalyzer imageQualityAnalyzer() {
    return new ImageQualityAnalyzer();
  }

  @Bean
  public OcrEngine ocrEngine() {
    CatalogProperties.Ocr ocr = props.getOcr();
    return new TesseractOcrEngine(ocr.getTessdataPath(), ocr.getDpi());
  }

  @Bean
  public MultiStrategyOcrRunner multiStrategyOcrRunner(
      OcrEngine ocrEngine, ImagePreprocessor imagePreprocessor) {
    return new MultiStrategyOcrRunner(
        ocrEngine, imagePreprocessor, OcrStrategies.defaults(props.getOcr().getLanguage()));
  }

  // -------------------
  // Vision
  // -------------------

  @Bean
  public VisionClient visionClient() {
    return new SpringAiVisionClient(chatClientBuilder);
  }

  @Bean
  public VisionExtractor visionExtractor(
      VisionClient visionClient,
      ImageCompressor imageCompressor,
      ImageQualityAnalyzer imageQualityAnalyzer,
      PromptConfig visionPrompt) {
    return new VisionExtractor(
        visionClient, imageCompressor, imageQualityAnalyzer, visionPrompt, props.getVision());
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public DualPathOrchestrator dualPathOrchestrator(
      MultiStrategyOcrRunner multiStrategyOcrRunner,
      VisionExtractor visionExtractor,
      @Qualifier("pipelineExecutor") ThreadPoolTaskExecutor pipelineExecutor) {
    return new DualPathOrchestrator(
        multiStrategyOcrRunner,
        visionExtractor,
        pipelineExecutor,
        props.getPipeline().toProcessingConfig());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "catalog.storage",
      name = "type",
      havingValue = "local",
      matchIfMissing = true)
  public ImageResolver localImageResolver() {
    Path dir = Path.of(props.getStorage().getLocalDir());
    log.info("storage.local dir={}", dir.toAbsolutePath());
    return new LocalImageResolver(dir);
  }

  @Bean
  @ConditionalOnProperty(prefix = "catalog.storage", name = "type", havingValue = "s3")
  public ImageResolver s3ImageResolver() {
    CatalogProperties.Storage storage = props.getStorage();
    log.info("storage.s3 bucket={} prefix={}", storage.getBucket(), storage.getPrefix());
    return new S3ImageResolver(s3Client, storage.getBucket(), storage.getPrefix());
  }

  @Bean
  public ImageCatalogService imageCatalogService(
      ImageResolver imageResolver, DualPathOrchestrator dualPathOrchestrator) {
    return new ImageCatalogService(imageResolver, dualPathOrchestrator, processedImageRepository);
  }

  // -------------------
  // Quality
  // -------------------

  @Bean
  public QualityStore qualityStore() {
    return new JdbcQualityRepository(jdbcTemplate);
  }

  @Bean
  public QualityValidator qualityValidator(
      DualPathOrchestrator dualPathOrchestrator,
      ImageResolver imageResolver,
      QualityStore qualityStore,
      Clock clock) {
    return new QualityValidator(dualPathOrchestrator, imageResolver, qualityStore, clock);
  }
}
