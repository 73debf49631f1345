package com.cario.catalog.app.service.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Guesses object categories from OCR text by keyword. Always includes {@code product}. Keywords
 * match as substrings; short tokens that occur inside ordinary words match as patterns instead.
 */
public final class ObjectKeywordDetector {

  public static final String DEFAULT_OBJECT = "product";

  private static final List<KeywordRule> RULES =
      List.of(
          new KeywordRule("phone", "phone", "mobile", "smartphone"),
          new KeywordRule("computer", "computer", "laptop", "pc"),
          new KeywordRule("cable", "cable", "wire", "cord"),
          new KeywordRule("battery", "battery", "power"),
          new KeywordRule("power_supply", "adapter", "charger", "power supply")
              .or(Pattern.compile("\\bpsu\\b"), Pattern.compile("\\d+\\s*mah\\b")),
          new KeywordRule("tool", "tool", "equipment"),
          new KeywordRule("book", "book", "manual"),
          new KeywordRule("package", "box", "package"),
          new KeywordRule("electronics", "electronic", "circuit", "pcb", "voltage"),
          new KeywordRule(
              "labeled_product", "barcode", "upc", "serial", "model", "part no", "sku"));

  private ObjectKeywordDetector() {}

  /** Categories in rule order, starting with {@code product}, without duplicates. */
  public static List<String> detect(String text) {
    Set<String> objects = new LinkedHashSet<>();
    objects.add(DEFAULT_OBJECT);
    if (text != null) {
      String lower = text.toLowerCase(Locale.ROOT);
      for (KeywordRule rule : RULES) {
        if (rule.matches(lower)) {
          objects.add(rule.object);
        }
      }
    }
    return new ArrayList<>(objects);
  }

  private static final class KeywordRule {
    private final String object;
    private final List<String> keywords;
    private final List<Pattern> patterns;

    private KeywordRule(String object, String... keywords) {
      this(object, List.of(keywords), List.of());
    }

    private KeywordRule(String object, List<String> keywords, List<Pattern> patterns) {
      this.object = object;
      this.keywords = keywords;
      this.patterns = patterns;
    }

    /** Same rule, also matching any of {@code extra} against the lower-cased text. */
    private KeywordRule or(Pattern... extra) {
      return new KeywordRule(object, keywords, List.of(extra));
    }

    private boolean matches(String lowerText) {
      return keywords.stream().anyMatch(lowerText::contains)
          || patterns.stream().anyMatch(p -> p.matcher(lowerText).find());
    }
  }
}
