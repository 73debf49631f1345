package com.cario.catalog.app.exception;

/** Thrown when the OCR engine itself (native library, language data) cannot be used. */
public class OcrEngineUnavailableException extends OcrProcessingException {

  public OcrEngineUnavailableException(String message) {
    super(message);
  }

  public OcrEngineUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
