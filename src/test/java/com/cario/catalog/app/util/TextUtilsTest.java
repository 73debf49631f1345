package com.cario.catalog.app.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextUtilsTest {

  @Test
  void truncateCollapsesWhitespace() {
    assertEquals("ACME 18V drill", TextUtils.truncate("ACME\n18V   drill", 40));
    assertEquals("ACME...", TextUtils.truncate("ACME 18V drill", 4));
    assertEquals("", TextUtils.truncate(null, 10));
  }

  @Test
  void significantWordsDropShortTokensAndDuplicates() {
    assertEquals(
        List.of("acme", "drill", "18v"),
        List.copyOf(TextUtils.significantWords("ACME drill 18V is an Acme DRILL")));
    assertTrue(TextUtils.significantWords("   ").isEmpty());
  }
}
