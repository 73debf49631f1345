package com.cario.catalog.app.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Error body returned by the REST layer. */
@Value
@Builder
public class ApiError {

  public static final String IMAGE_NOT_FOUND = "IMAGE_NOT_FOUND";
  public static final String IMAGE_UNAVAILABLE = "IMAGE_UNAVAILABLE";
  public static final String TEST_CASE_NOT_FOUND = "TEST_CASE_NOT_FOUND";
  public static final String BAD_REQUEST = "BAD_REQUEST";
  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  String errorId;
  String code;
  String message;
  String path;
  Instant timestamp;
}
