package com.cario.catalog.app.exception;

/** Transport or API-level failure of the vision model call. */
public class VisionApiException extends RuntimeException {

  public enum Category {
    AUTHENTICATION,
    RATE_LIMIT,
    TRANSPORT,
    UNKNOWN
  }

  private final Category category;

  public VisionApiException(Category category, String message, Throwable cause) {
    super(message, cause);
    this.category = category;
  }

  public Category getCategory() {
    return category;
  }

  public boolean isRateLimited() {
    return category == Category.RATE_LIMIT;
  }
}
