package com.cario.catalog.app.service.pipeline;

import com.cario.catalog.app.model.ExtractionResult;
import com.cario.catalog.app.model.ImageQuality;
import com.cario.catalog.app.model.MergedResult;
import com.cario.catalog.app.model.OrchestrationResult;
import com.cario.catalog.app.model.ProcessingConfig;
import com.cario.catalog.app.model.QualityScores;
import com.cario.catalog.app.model.VisionResult;
import com.cario.catalog.app.service.ocr.MultiStrategyOcrRunner;
import com.cario.catalog.app.service.vision.VisionExtractor;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.log4j.Log4j2;

/**
 * Dual-path processing of one image.
 *
 * <ol>
 *   <li>Run the OCR runner and the vision extractor concurrently on the pipeline executor. Each
 *       path is bounded by its timeout; a failed or timed out path contributes a placeholder.
 *   <li>Pick the best OCR candidate, if any.
 *   <li>Merge both sides with the configured {@link com.cario.catalog.app.model.MergeStrategy}.
 *   <li>Attach quality scores, image quality and timing.
 * </ol>
 *
 * {@link #processImage(Path)} never throws. When every enabled path fails, or anything else goes
 * wrong, the call comes back as an unsuccessful {@link OrchestrationResult} naming the failures.
 */
@Log4j2
public class DualPathOrchestrator {

  static final String AI_DISABLED = "AI processing disabled";
  static final String AI_FAILED_PREFIX = "AI processing failed: ";
  static final String OCR_FAILED_PREFIX = "OCR processing failed: ";
  static final String NO_IMAGE = "Image path is required";

  private final MultiStrategyOcrRunner ocrRunner;
  private final VisionExtractor visionExtractor;
  private final Executor executor;
  private final ProcessingConfig config;

  public DualPathOrchestrator(
      MultiStrategyOcrRunner ocrRunner,
      VisionExtractor visionExtractor,
      Executor executor,
      ProcessingConfig config) {
    this.ocrRunner = Objects.requireNonNull(ocrRunner);
    this.visionExtractor = Objects.requireNonNull(visionExtractor);
    this.executor = Objects.requireNonNull(executor);
    this.config = Objects.requireNonNull(config);
  }

  public ProcessingConfig getConfig() {
    return config;
  }

  public OrchestrationResult processImage(Path image) {
    String reqId = UUID.randomUUID().toString().substring(0, 8);
    long t0 = System.nanoTime();

    try {
      if (image == null) {
        throw new IllegalArgumentException(NO_IMAGE);
      }
      log.info(
          "pipeline.start id={} image={} strategy={} ocrPath={} aiPath={}",
          reqId,
          image.getFileName(),
          config.getFallbackStrategy().getTag(),
          config.isEnableOcrPath(),
          config.isEnableAiPath());

      AtomicReference<String> ocrFailure = new AtomicReference<>();
      AtomicReference<String> visionFailure = new AtomicReference<>();
      CompletableFuture<List<ExtractionResult>> ocrFuture = startOcr(reqId, image, ocrFailure);
      CompletableFuture<VisionResult> visionFuture = startVision(reqId, image, visionFailure);
      CompletableFuture.allOf(ocrFuture, visionFuture).join();

      List<ExtractionResult> ocrResults = ocrFuture.join();
      VisionResult vision = visionFuture.join();

      boolean ocrDown = !config.isEnableOcrPath() || ocrFailure.get() != null;
      boolean visionDown = !config.isEnableAiPath() || visionFailure.get() != null;
      if (ocrDown && visionDown) {
        String message = joinFailures(ocrFailure.get(), visionFailure.get());
        long ms = elapsedMs(t0);
        log.error("pipeline.allPathsFailed id={} durationMs={} msg={}", reqId, ms, message);
        return errorResult(message, ms);
      }
      Optional<ExtractionResult> bestOcr =
          ocrResults.isEmpty()
              ? Optional.empty()
              : Optional.of(MultiStrategyOcrRunner.selectBest(ocrResults));

      MergedResult merged =
          ResultMerger.merge(
              config.getFallbackStrategy(), bestOcr, vision, config.getConfidenceThreshold());
      QualityScores scores = QualityScoreCalculator.calculate(ocrResults, bestOcr, vision, merged);
      ImageQuality imageQuality = visionExtractor.analyzeImageQuality(image);

      long ms = elapsedMs(t0);
      log.info(
          "pipeline.success id={} method={} strategy={} confidence={} textLength={} objects={}"
              + " durationMs={}",
          reqId,
          merged.getMethod(),
          merged.getStrategy(),
          String.format("%.2f", merged.getConfidence()),
          merged.getText().length(),
          merged.getObjects().size(),
          ms);

      return OrchestrationResult.builder()
          .finalText(merged.getText())
          .finalDescription(merged.getDescription())
          .finalObjects(merged.getObjects())
          .finalConfidence(merged.getConfidence())
          .method(merged.getMethod())
          .processingDetails(
              OrchestrationResult.ProcessingDetails.builder()
                  .ocrResults(ocrResults)
                  .visionResult(vision)
                  .mergeStrategy(merged.getStrategy())
                  .qualityScores(scores)
                  .imageQuality(imageQuality)
                  .build())
          .processingTimeMs(ms)
          .success(true)
          .build();

    } catch (RuntimeException e) {
      long ms = elapsedMs(t0);
      Throwable cause = unwrap(e);
      log.error(
          "pipeline.error id={} image={} durationMs={} msg={}",
          reqId,
          image == null ? null : image.getFileName(),
          ms,
          cause.getMessage(),
          cause);
      return errorResult(describe(cause), ms);
    }
  }

  private CompletableFuture<List<ExtractionResult>> startOcr(
      String reqId, Path image, AtomicReference<String> failure) {
    if (!config.isEnableOcrPath()) {
      return CompletableFuture.completedFuture(List.of());
    }
    Duration timeout = config.getOcrTimeout();
    return CompletableFuture.supplyAsync(() -> ocrRunner.runAll(image), executor)
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(
            e -> {
              String msg = describe(unwrap(e), "OCR", timeout);
              log.warn("pipeline.ocr.failed id={} msg={}", reqId, msg);
              failure.set(msg);
              return List.of();
            });
  }

  private CompletableFuture<VisionResult> startVision(
      String reqId, Path image, AtomicReference<String> failure) {
    if (!config.isEnableAiPath()) {
      return CompletableFuture.completedFuture(VisionResult.placeholder(AI_DISABLED));
    }
    Duration timeout = config.getVisionTimeout();
    return CompletableFuture.supplyAsync(() -> visionExtractor.extract(image), executor)
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .exceptionally(
            e -> {
              String msg = describe(unwrap(e), "AI vision", timeout);
              log.warn("pipeline.vision.failed id={} msg={}", reqId, msg);
              failure.set(msg);
              return VisionResult.placeholder(AI_FAILED_PREFIX + msg);
            });
  }

  static OrchestrationResult errorResult(String message, long processingTimeMs) {
    return OrchestrationResult.builder()
        .finalText("Error during image processing")
        .finalDescription("Failed to process image due to technical error")
        .finalObjects(List.of("error"))
        .finalConfidence(ResultMerger.MIN_CONFIDENCE)
        .method("error")
        .processingDetails(
            OrchestrationResult.ProcessingDetails.builder()
                .ocrResults(List.of())
                .visionResult(VisionResult.placeholder("Failed"))
                .mergeStrategy("error")
                .qualityScores(QualityScores.builder().build())
                .build())
        .processingTimeMs(processingTimeMs)
        .success(false)
        .error(message)
        .build();
  }

  /** Failure messages of the enabled paths; a disabled path has none. */
  static String joinFailures(String ocrFailure, String visionFailure) {
    return Stream.of(
            ocrFailure == null ? null : OCR_FAILED_PREFIX + ocrFailure,
            visionFailure == null ? null : AI_FAILED_PREFIX + visionFailure)
        .filter(Objects::nonNull)
        .collect(Collectors.joining("; "));
  }

  private static Throwable unwrap(Throwable e) {
    Throwable t = e;
    while (t instanceof CompletionException && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }

  private static String describe(Throwable cause, String path, Duration timeout) {
    if (cause instanceof TimeoutException) {
      return path + " timed out after " + timeout.toMillis() + "ms";
    }
    return describe(cause);
  }

  private static String describe(Throwable cause) {
    return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
  }

  private static long elapsedMs(long t0) {
    return (System.nanoTime() - t0) / 1_000_000;
  }
}
