package com.cario.catalog.app.service.ocr;

import com.cario.catalog.app.exception.OcrEngineUnavailableException;
import com.cario.catalog.app.exception.OcrProcessingException;
import com.cario.catalog.app.model.OcrEngineParams;
import java.nio.file.Path;
import java.util.Locale;
import lombok.extern.log4j.Log4j2;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

/**
 * Tess4J backed engine. {@link Tesseract} instances are not thread safe, so each call gets its
 * own instance configured for the requested language and modes.
 */
@Log4j2
public class TesseractOcrEngine implements OcrEngine {

  private final String tessdataPath;
  private final int dpi;

  public TesseractOcrEngine(String tessdataPath, int dpi) {
    this.tessdataPath = tessdataPath;
    this.dpi = dpi;
  }

  @Override
  public String recognize(Path image, OcrEngineParams params) {
    try {
      Tesseract tesseract = newTesseract(params);
      String text = tesseract.doOCR(image.toFile());
      return text == null ? "" : text;
    } catch (LinkageError e) {
      log.error("tesseract.unavailable msg={}", e.getMessage());
      throw new OcrEngineUnavailableException("Tesseract native library not available", e);
    } catch (TesseractException | RuntimeException e) {
      if (isEngineUnavailable(e)) {
        log.error("tesseract.unavailable lang={} msg={}", params.getLanguage(), e.getMessage());
        throw new OcrEngineUnavailableException(
            "Tesseract could not be initialised for language " + params.getLanguage(), e);
      }
      throw new OcrProcessingException(
          "Tesseract failed on " + image.getFileName() + ": " + e.getMessage(), e);
    }
  }

  Tesseract newTesseract(OcrEngineParams params) {
    Tesseract t = new Tesseract();
    if (tessdataPath != null && !tessdataPath.isBlank()) {
      t.setDatapath(tessdataPath);
    }
    t.setLanguage(params.getLanguage());
    t.setOcrEngineMode(params.getEngineMode());
    t.setPageSegMode(params.getPageSegMode());
    t.setVariable("user_defined_dpi", String.valueOf(dpi));
    return t;
  }

  /** Initialisation and language-data errors surface as generic exceptions from Tess4J. */
  static boolean isEngineUnavailable(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof LinkageError) {
        return true;
      }
      String msg = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
      if (msg.contains("error opening data file")
          || msg.contains("failed loading language")
          || msg.contains("failed to initialize")
          || msg.contains("tessdata")) {
        return true;
      }
    }
    return false;
  }
}
