package com.cario.catalog.app.exception;

/** Thrown when the OCR engine ran but could not produce text for an image-specific reason. */
public class OcrProcessingException extends RuntimeException {

  public OcrProcessingException(String message) {
    super(message);
  }

  public OcrProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
