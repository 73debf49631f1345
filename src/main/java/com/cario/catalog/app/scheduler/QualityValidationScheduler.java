package com.cario.catalog.app.scheduler;

import com.cario.catalog.app.model.QualityReport;
import com.cario.catalog.app.service.quality.QualityValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodic full validation run, enabled with {@code catalog.quality.scheduled=true}. Failures are
 * logged by the scheduler's error handler.
 */
@Log4j2
@RequiredArgsConstructor
public class QualityValidationScheduler {

  private final QualityValidator validator;

  @Scheduled(cron = "${catalog.quality.cron:0 0 3 * * *}")
  public void runScheduledValidation() {
    log.info("quality.scheduler.tick");
    QualityReport report = validator.runFullValidation();
    log.info(
        "quality.scheduler.done reportId={} passed={}/{}",
        report.getId(),
        report.getPassedTests(),
        report.getTotalTests());
  }
}
