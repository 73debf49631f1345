package com.cario.catalog.app.model;

import lombok.Builder;
import lombok.Value;

/** Tesseract invocation parameters: language, OCR engine mode (OEM), page segmentation (PSM). */
@Value
@Builder
public class OcrEngineParams {
  @Builder.Default String language = "eng";
  int engineMode;
  int pageSegMode;
}
