package com.cario.catalog.app.service.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ObjectKeywordDetectorTest {

  @Test
  void alwaysStartsWithProduct() {
    assertEquals(List.of("product"), ObjectKeywordDetector.detect(null));
    assertEquals(List.of("product"), ObjectKeywordDetector.detect("lorem ipsum"));
  }

  @Test
  void matchesKeywordsCaseInsensitivelyInRuleOrder() {
    assertEquals(
        List.of("product", "cable", "power_supply"),
        ObjectKeywordDetector.detect("USB-C Charger 5000mAh with Cable"));
    assertEquals(
        List.of("product", "computer", "battery", "package"),
        ObjectKeywordDetector.detect("Laptop Battery Box"));
  }

  @Test
  void labelKeywordsMarkLabeledProduct() {
    assertEquals(
        List.of("product", "labeled_product"), ObjectKeywordDetector.detect("SKU 00042 serial"));
  }

  @Test
  void batteryPackListsEachCategoryOnce() {
    List<String> objects =
        ObjectKeywordDetector.detect("Battery pack, 10000mAh, USB-C cable included");

    assertEquals(List.of("product", "cable", "battery", "power_supply"), objects);
    assertEquals(objects.size(), Set.copyOf(objects).size());
  }

  @Test
  void shortPowerTokensNeedWordBoundaries() {
    assertEquals(List.of("product"), ObjectKeywordDetector.detect("Mahogany frame"));
    assertEquals(List.of("product"), ObjectKeywordDetector.detect("lorem ipsum dolor"));
    assertEquals(
        List.of("product", "power_supply"), ObjectKeywordDetector.detect("ATX PSU 650W"));
    assertEquals(List.of("product", "power_supply"), ObjectKeywordDetector.detect("2600 mAh"));
  }
}
