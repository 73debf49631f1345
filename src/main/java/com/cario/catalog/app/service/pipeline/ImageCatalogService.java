package com.cario.catalog.app.service.pipeline;

import com.cario.catalog.app.model.OrchestrationResult;
import com.cario.catalog.app.model.ProcessedImageRecord;
import com.cario.catalog.app.repository.ResultSink;
import com.cario.catalog.app.repository.dynamodb.ProcessedImageRepository;
import com.cario.catalog.app.service.storage.ImageResolver;
import com.cario.catalog.app.service.storage.ResolvedImage;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/** Resolve an image id, run the dual-path pipeline on it, and persist the outcome. */
@Log4j2
public class ImageCatalogService {

  private final ImageResolver imageResolver;
  private final DualPathOrchestrator orchestrator;
  private final ResultSink resultSink;

  public ImageCatalogService(
      ImageResolver imageResolver, DualPathOrchestrator orchestrator, ResultSink resultSink) {
    this.imageResolver = Objects.requireNonNull(imageResolver);
    this.orchestrator = Objects.requireNonNull(orchestrator);
    this.resultSink = Objects.requireNonNull(resultSink);
  }

  /**
   * @throws com.cario.catalog.app.exception.ImageNotFoundException if the id is unknown
   * @throws com.cario.catalog.app.exception.ImageResolutionException if storage is unavailable
   */
  public OrchestrationResult processAndStore(String imageId) {
    try (ResolvedImage image = imageResolver.resolve(imageId)) {
      OrchestrationResult result = orchestrator.processImage(image.getPath());
      try {
        resultSink.save(imageId, image.getUri(), result);
      } catch (RuntimeException e) {
        log.error("catalog.persist.failed imageId={} msg={}", imageId, e.getMessage(), e);
        throw e;
      }
      log.info(
          "catalog.processed imageId={} uri={} success={} method={}",
          imageId,
          image.getUri(),
          result.isSuccess(),
          result.getMethod());
      return result;
    }
  }

  /** Last stored result for an image, when the sink supports lookups. */
  public Optional<ProcessedImageRecord> findProcessed(String imageId) {
    if (resultSink instanceof ProcessedImageRepository repository) {
      return repository.find(imageId);
    }
    return Optional.empty();
  }
}
