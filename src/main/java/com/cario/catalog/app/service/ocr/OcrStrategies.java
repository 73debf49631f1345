package com.cario.catalog.app.service.ocr;

import com.cario.catalog.app.model.OcrEngineParams;
import com.cario.catalog.app.model.OcrStrategy;
import java.util.List;

/** The fixed strategy table, in execution order. */
public final class OcrStrategies {

  public static final String PRODUCT_LABELS = "product_labels";
  public static final String BARCODES_NUMBERS = "barcodes_numbers";
  public static final String MIXED_TEXT = "mixed_text";
  public static final String SMALL_TEXT = "small_text";

  /** OEM 1: LSTM only. */
  private static final int OEM_LSTM = 1;

  private OcrStrategies() {}

  public static List<OcrStrategy> defaults(String language) {
    return List.of(
        strategy(
            PRODUCT_LABELS,
            language,
            6,
            List.of("enhance_contrast", "deskew"),
            "Single uniform block, tuned for printed product labels"),
        strategy(
            BARCODES_NUMBERS,
            language,
            8,
            List.of("enhance_contrast", "sharpen"),
            "Single word, tuned for barcode digits and serial numbers"),
        strategy(
            MIXED_TEXT,
            language,
            3,
            List.of("denoise", "enhance_contrast"),
            "Fully automatic page segmentation for mixed layouts"),
        strategy(
            SMALL_TEXT,
            language,
            7,
            List.of("upscale", "enhance_contrast", "sharpen"),
            "Single text line, upscaled for fine print"));
  }

  public static List<OcrStrategy> defaults() {
    return defaults("eng");
  }

  private static OcrStrategy strategy(
      String name, String language, int psm, List<String> steps, String description) {
    return OcrStrategy.builder()
        .name(name)
        .params(
            OcrEngineParams.builder()
                .language(language)
                .engineMode(OEM_LSTM)
                .pageSegMode(psm)
                .build())
        .preprocessingSteps(steps)
        .description(description)
        .build();
  }
}
