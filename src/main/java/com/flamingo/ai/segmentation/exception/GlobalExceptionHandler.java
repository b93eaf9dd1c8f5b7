package com.flamingo.ai.segmentation.exception;

import com.fasterxml.jackson.databind.JsonMappingException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures of the segmentation endpoints to {@link ApiError} bodies. Every mapped failure is
 * counted in {@code api_errors_total}, tagged by {@code error_type}.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private static final String UNREADABLE_MESSAGE = "Page records could not be parsed";

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidSegmentationRequestException.class)
  public ResponseEntity<ApiError> handleInvalidRequest(
      InvalidSegmentationRequestException ex, HttpServletRequest request) {

    ApiError error =
        ApiError.forRequest(ApiError.INVALID_REQUEST, request).message(ex.getUserMessage()).build();
    log.warn("Invalid segmentation request [{}]: {}", error.getErrorId(), ex.getMessage());

    return respond(HttpStatus.BAD_REQUEST, "invalid_request", error);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    List<ApiError.FieldViolation> violations =
        ex.getBindingResult().getFieldErrors().stream()
            .map(
                fieldError ->
                    new ApiError.FieldViolation(
                        fieldError.getField(), fieldError.getDefaultMessage()))
            .toList();
    String message =
        violations.isEmpty()
            ? "Validation failed"
            : violations.get(0).field() + ": " + violations.get(0).message();

    ApiError error =
        ApiError.forRequest(ApiError.VALIDATION_ERROR, request)
            .message(message)
            .violations(violations)
            .build();
    log.warn("Validation error [{}]: {}", error.getErrorId(), violations);

    return respond(HttpStatus.BAD_REQUEST, "validation_error", error);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    String location = mappingLocation(ex);
    String message =
        location.isEmpty() ? UNREADABLE_MESSAGE : UNREADABLE_MESSAGE + " at " + location;

    ApiError error =
        ApiError.forRequest(ApiError.UNREADABLE_PAGES, request).message(message).build();
    log.warn(
        "Unreadable page records [{}]: {}",
        error.getErrorId(),
        ex.getMostSpecificCause().getMessage());

    return respond(HttpStatus.BAD_REQUEST, "unreadable_pages", error);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    ApiError error =
        ApiError.forRequest(ApiError.INTERNAL_ERROR, request)
            .message("An unexpected error occurred. Please try again later.")
            .build();
    log.error("Unexpected error [{}]: {}", error.getErrorId(), ex.getMessage(), ex);

    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", error);
  }

  private ResponseEntity<ApiError> respond(HttpStatus status, String errorType, ApiError error) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
    return ResponseEntity.status(status).body(error);
  }

  /** JSON path of the value Jackson could not bind, e.g. {@code pages[2].page_number}. */
  private static String mappingLocation(HttpMessageNotReadableException ex) {
    Throwable cause = ex.getCause();
    while (cause != null && !(cause instanceof JsonMappingException)) {
      cause = cause.getCause();
    }
    if (cause == null) {
      return "";
    }

    StringBuilder path = new StringBuilder();
    for (JsonMappingException.Reference reference : ((JsonMappingException) cause).getPath()) {
      if (reference.getFieldName() != null) {
        if (path.length() > 0) {
          path.append('.');
        }
        path.append(reference.getFieldName());
      } else if (reference.getIndex() >= 0) {
        path.append('[').append(reference.getIndex()).append(']');
      }
    }
    return path.toString();
  }
}
