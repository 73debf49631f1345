package com.cario.catalog.app.config;

import com.cario.catalog.app.model.MergeStrategy;
import com.cario.catalog.app.model.ProcessingConfig;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Settings under {@code catalog.*} in application.yaml. */
@Data
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

  private Pipeline pipeline = new Pipeline();
  private Ocr ocr = new Ocr();
  private Vision vision = new Vision();
  private Storage storage = new Storage();
  private Quality quality = new Quality();

  @Data
  public static class Pipeline {
    private boolean enableOcrPath = true;
    private boolean enableAiPath = true;
    private double confidenceThreshold = ProcessingConfig.DEFAULT_CONFIDENCE_THRESHOLD;
    private MergeStrategy fallbackStrategy = MergeStrategy.BEST_CONFIDENCE;
    private Duration ocrTimeout = ProcessingConfig.DEFAULT_OCR_TIMEOUT;
    private Duration visionTimeout = ProcessingConfig.DEFAULT_VISION_TIMEOUT;

    /** Threads shared by the OCR and vision branches of concurrent requests. */
    private int executorPoolSize = 8;

    private int executorQueueCapacity = 100;

    public ProcessingConfig toProcessingConfig() {
      return ProcessingConfig.builder()
          .enableOcrPath(enableOcrPath)
          .enableAiPath(enableAiPath)
          .confidenceThreshold(confidenceThreshold)
          .fallbackStrategy(fallbackStrategy)
          .ocrTimeout(ocrTimeout)
          .visionTimeout(visionTimeout)
          .build();
    }
  }

  @Data
  public static class Ocr {
    private String language = "eng";

    /** Directory containing {@code tessdata}; empty means the OS installation. */
    private String tessdataPath = "";

    private int dpi = 300;

    /** Upscale enlarges images whose longer side is below this many pixels. */
    private int upscaleTargetPx = 2000;

    private double maxUpscaleFactor = 4.0;
  }

  @Data
  public static class Vision {
    private String model = "gpt-4o";
    private double temperature = 0.1;
    private int maxTokens = 1500;
    private int maxImageSize = 1024;
    private int compressionQuality = 85;

    /** Request a strict JSON schema response instead of free text. */
    private boolean structuredOutput = true;

    /** Classpath location of the prompt, used when {@code promptBucket} is blank. */
    private String promptResource = "prompts/vision-extraction.yaml";

    private String promptBucket = "";
    private String promptKey = "";
  }

  @Data
  public static class Storage {
    /** {@code local} or {@code s3}. */
    private String type = "local";

    private String localDir = "uploads/image-cataloging";
    private String bucket = "";
    private String prefix = "image-cataloging/";
  }

  @Data
  public static class Quality {
    private boolean scheduled = false;
    private String cron = "0 0 3 * * *";
  }
}
