package com.cario.catalog.app.service.ocr;

import java.util.regex.Pattern;

/**
 * Text-quality heuristic used in place of engine confidences, which are not comparable across
 * page segmentation modes.
 */
public final class OcrConfidenceScorer {

  public static final double MIN_CONFIDENCE = 0.1;
  public static final double MAX_CONFIDENCE = 0.95;

  private static final Pattern ALPHANUMERIC = Pattern.compile("[A-Za-z0-9]");
  private static final Pattern DIGIT = Pattern.compile("[0-9]");
  private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");
  private static final Pattern LONG_DIGIT_RUN = Pattern.compile("\\d{8,}");
  private static final Pattern SPECIAL = Pattern.compile("[^\\w\\s\\-.,]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s");

  private OcrConfidenceScorer() {}

  /**
   * @param rawText untrimmed engine output
   * @param strategy name of the strategy that produced it
   * @return a score in [0.1, 0.95]
   */
  public static double score(String rawText, String strategy) {
    if (rawText == null || rawText.isBlank()) {
      return MIN_CONFIDENCE;
    }

    double confidence = 0.5;
    int length = rawText.length();
    if (length > 10) confidence += 0.1;
    if (length > 30) confidence += 0.1;
    if (length > 100) confidence += 0.1;

    boolean hasDigits = DIGIT.matcher(rawText).find();
    boolean hasUppercase = UPPERCASE.matcher(rawText).find();
    if (ALPHANUMERIC.matcher(rawText).find()) confidence += 0.1;
    if (hasDigits) confidence += 0.1;
    if (hasUppercase) confidence += 0.05;

    if (OcrStrategies.BARCODES_NUMBERS.equals(strategy)
        && LONG_DIGIT_RUN.matcher(rawText).find()) {
      confidence += 0.2;
    }
    if (OcrStrategies.PRODUCT_LABELS.equals(strategy) && hasUppercase && hasDigits) {
      confidence += 0.15;
    }

    if (ratio(SPECIAL, rawText) > 0.3) confidence -= 0.2;
    // fragmented output
    if (ratio(WHITESPACE, rawText) > 0.7) confidence -= 0.15;

    return clamp(confidence);
  }

  static double clamp(double confidence) {
    return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
  }

  private static double ratio(Pattern pattern, String text) {
    long count = pattern.matcher(text).results().count();
    return (double) count / text.length();
  }
}
