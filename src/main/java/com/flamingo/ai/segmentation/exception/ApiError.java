package com.flamingo.ai.segmentation.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiError {

  public static final String INVALID_REQUEST = "SEGMENTATION_001";
  public static final String UNREADABLE_PAGES = "SEGMENTATION_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Short id printed in the log line for the same failure. */
  private final String errorId;

  private final String code;

  /** User-facing message. */
  private final String message;

  /** Every rejected request field; empty unless the request failed validation. */
  @Singular private final List<FieldViolation> violations;

  private final Instant timestamp;
  private final String path;

  /** Builder pre-filled with a fresh error id, the request path and the current time. */
  public static ApiErrorBuilder forRequest(String code, HttpServletRequest request) {
    return builder()
        .errorId(UUID.randomUUID().toString().substring(0, 8))
        .code(code)
        .path(request.getRequestURI())
        .timestamp(Instant.now());
  }

  /**
   * One rejected field.
   *
   * @param field request field path, e.g. {@code pages} or {@code mergeThreshold}
   * @param message constraint message
   */
  public record FieldViolation(String field, String message) {}
}
