package com.cario.catalog.app.config;

import com.cario.catalog.app.scheduler.QualityValidationScheduler;
import com.cario.catalog.app.service.quality.QualityValidator;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Log4j2
@Configuration
@EnableScheduling
public class SchedulerConfig {

  @Value("${scheduled.threadpool.size:2}")
  private int poolSize;

  @Value("${scheduled.threadpool.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  /** Dedicated scheduler pool for @Scheduled jobs with graceful shutdown and error logging. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("catalog-scheduler-");
    scheduler.setErrorHandler(t -> log.error("Uncaught exception in scheduled task", t));
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);
    scheduler.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    scheduler.initialize();
    log.info(
        "ThreadPoolTaskScheduler initialized poolSize={} awaitTerminationSeconds={}",
        poolSize,
        awaitTerminationSeconds);
    return scheduler;
  }

  /**
   * Runs the OCR and vision branches of every request. Each request holds at most two threads;
   * a saturated queue fails the request instead of blocking the caller.
   */
  @Bean
  public ThreadPoolTaskExecutor pipelineExecutor(CatalogProperties props) {
    CatalogProperties.Pipeline p = props.getPipeline();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(p.getExecutorPoolSize());
    executor.setMaxPoolSize(p.getExecutorPoolSize());
    executor.setQueueCapacity(p.getExecutorQueueCapacity());
    executor.setThreadNamePrefix("pipeline-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
    executor.initialize();
    log.info(
        "pipelineExecutor initialized poolSize={} queueCapacity={}",
        p.getExecutorPoolSize(),
        p.getExecutorQueueCapacity());
    return executor;
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "catalog.quality",
      name = "scheduled",
      havingValue = "true",
      matchIfMissing = false)
  public QualityValidationScheduler qualityValidationScheduler(QualityValidator validator) {
    return new QualityValidationScheduler(validator);
  }
}
