package com.cario.catalog.app.scheduler;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cario.catalog.app.model.QualityReport;
import com.cario.catalog.app.service.quality.QualityValidator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QualityValidationSchedulerTest {

  @Mock private QualityValidator validator;

  @Test
  void tickRunsFullValidation() {
    when(validator.runFullValidation())
        .thenReturn(QualityReport.builder().id(1L).totalTests(3).passedTests(3).build());

    new QualityValidationScheduler(validator).runScheduledValidation();

    verify(validator).runFullValidation();
  }

  @Test
  void failuresReachTheSchedulerErrorHandler() {
    when(validator.runFullValidation()).thenThrow(new IllegalStateException("db down"));

    assertThrows(
        IllegalStateException.class,
        () -> new QualityValidationScheduler(validator).runScheduledValidation());
  }
}
