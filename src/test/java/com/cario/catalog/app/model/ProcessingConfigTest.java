package com.cario.catalog.app.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.catalog.app.config.CatalogProperties;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ProcessingConfigTest {

  @Test
  void defaultsEnableBothPaths() {
    ProcessingConfig c = ProcessingConfig.defaults();
    assertTrue(c.isEnableOcrPath() && c.isEnableAiPath());
    assertEquals(0.7, c.getConfidenceThreshold(), 1e-9);
    assertEquals(MergeStrategy.BEST_CONFIDENCE, c.getFallbackStrategy());
  }

  @Test
  void rejectsBothPathsDisabled() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ProcessingConfig.builder().enableOcrPath(false).enableAiPath(false).build());
  }

  @Test
  void rejectsThresholdOutsideUnitInterval() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ProcessingConfig.builder().confidenceThreshold(1.5).build());
  }

  @Test
  void propertiesMapOntoPolicy() {
    CatalogProperties.Pipeline p = new CatalogProperties.Pipeline();
    p.setFallbackStrategy(MergeStrategy.OCR_ONLY);
    p.setConfidenceThreshold(0.5);
    p.setOcrTimeout(Duration.ofSeconds(5));

    ProcessingConfig c = p.toProcessingConfig();

    assertEquals(MergeStrategy.OCR_ONLY, c.getFallbackStrategy());
    assertEquals(0.5, c.getConfidenceThreshold(), 1e-9);
    assertEquals(Duration.ofSeconds(5), c.getOcrTimeout());
  }

  @Test
  void strategyTagsRoundTrip() {
    assertEquals(MergeStrategy.MERGE_ALL, MergeStrategy.fromTag("merge_all"));
    assertEquals("ai_only", MergeStrategy.AI_ONLY.getTag());
    assertThrows(IllegalArgumentException.class, () -> MergeStrategy.fromTag("nope"));
  }
}
