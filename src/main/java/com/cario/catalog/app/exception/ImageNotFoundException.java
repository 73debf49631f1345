package com.cario.catalog.app.exception;

/** Thrown when an image identifier does not resolve to any stored image. */
public class ImageNotFoundException extends RuntimeException {

  private final String imageId;

  public ImageNotFoundException(String imageId) {
    super("Image not found: " + imageId);
    this.imageId = imageId;
  }

  public String getImageId() {
    return imageId;
  }
}
