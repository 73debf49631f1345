package com.cario.catalog.app.service.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.catalog.app.model.OcrEngineParams;
import java.util.List;
import org.junit.jupiter.api.Test;

class TesseractOcrEngineTest {

  @Test
  void languageDataErrorsMeanEngineUnavailable() {
    assertTrue(
        TesseractOcrEngine.isEngineUnavailable(
            new RuntimeException("Error opening data file /usr/share/tessdata/xyz.traineddata")));
    assertTrue(
        TesseractOcrEngine.isEngineUnavailable(
            new IllegalStateException(
                "wrapped", new RuntimeException("Failed loading language 'xyz'"))));
    assertTrue(TesseractOcrEngine.isEngineUnavailable(new UnsatisfiedLinkError("libtesseract")));
  }

  @Test
  void imageErrorsAreNotUnavailability() {
    assertFalse(
        TesseractOcrEngine.isEngineUnavailable(new RuntimeException("Unsupported image format")));
    assertFalse(TesseractOcrEngine.isEngineUnavailable(new RuntimeException((String) null)));
  }

  @Test
  void strategyTableMatchesTesseractModes() {
    List<Integer> psm =
        OcrStrategies.defaults("deu").stream()
            .map(s -> s.getParams().getPageSegMode())
            .toList();
    assertEquals(List.of(6, 8, 3, 7), psm);
    OcrEngineParams first = OcrStrategies.defaults("deu").get(0).getParams();
    assertEquals(1, first.getEngineMode());
    assertEquals("deu", first.getLanguage());
  }
}
