package com.cario.catalog.app.util;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public final class TextUtils {

  private TextUtils() {}

  /** Shortens {@code text} for log lines. */
  public static String truncate(String text, int max) {
    if (text == null) return "";
    String oneLine = text.replaceAll("\\s+", " ");
    return oneLine.length() <= max ? oneLine : oneLine.substring(0, max) + "...";
  }

  public static boolean isBlank(String text) {
    return text == null || text.isBlank();
  }

  /** Lower-cased words longer than two characters, in first-seen order. */
  public static Set<String> significantWords(String text) {
    if (isBlank(text)) return Set.of();
    return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\s+"))
        .filter(w -> w.length() > 2)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }
}
