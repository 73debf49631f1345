package com.cario.catalog.app.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

/** Maps domain exceptions raised by the catalog endpoints to {@link ApiError} responses. */
@Log4j2
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(ImageNotFoundException.class)
  public ResponseEntity<ApiError> handleImageNotFound(
      ImageNotFoundException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.warn("api.imageNotFound errorId={} imageId={}", errorId, ex.getImageId());
    return build(HttpStatus.NOT_FOUND, ApiError.IMAGE_NOT_FOUND, ex.getMessage(), errorId, request);
  }

  @ExceptionHandler(ImageResolutionException.class)
  public ResponseEntity<ApiError> handleImageUnavailable(
      ImageResolutionException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.error("api.imageUnavailable errorId={} msg={}", errorId, ex.getMessage(), ex);
    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        ApiError.IMAGE_UNAVAILABLE,
        "Image storage is temporarily unavailable",
        errorId,
        request);
  }

  @ExceptionHandler(TestCaseNotFoundException.class)
  public ResponseEntity<ApiError> handleTestCaseNotFound(
      TestCaseNotFoundException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.warn("api.testCaseNotFound errorId={} msg={}", errorId, ex.getMessage());
    return build(
        HttpStatus.NOT_FOUND, ApiError.TEST_CASE_NOT_FOUND, ex.getMessage(), errorId, request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + ": " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("api.validation errorId={} msg={}", errorId, message);
    return build(HttpStatus.BAD_REQUEST, ApiError.BAD_REQUEST, message, errorId, request);
  }

  @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
  public ResponseEntity<ApiError> handleConstraintViolation(
      Exception ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.warn("api.validation errorId={} msg={}", errorId, ex.getMessage());
    return build(HttpStatus.BAD_REQUEST, ApiError.BAD_REQUEST, ex.getMessage(), errorId, request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.warn("api.badRequest errorId={} msg={}", errorId, ex.getMessage());
    return build(HttpStatus.BAD_REQUEST, ApiError.BAD_REQUEST, ex.getMessage(), errorId, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    log.error("api.unexpected errorId={} msg={}", errorId, ex.getMessage(), ex);
    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred",
        errorId,
        request);
  }

  private static ResponseEntity<ApiError> build(
      HttpStatus status, String code, String message, String errorId, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private static String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
