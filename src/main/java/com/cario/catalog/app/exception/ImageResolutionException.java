package com.cario.catalog.app.exception;

/** Transient failure while fetching an image that may well exist (I/O, storage outage). */
public class ImageResolutionException extends RuntimeException {

  public ImageResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
