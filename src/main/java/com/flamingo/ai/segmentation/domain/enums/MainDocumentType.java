package com.flamingo.ai.segmentation.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/** Coarse document category a segment is classified into. */
public enum MainDocumentType {
  /** Financial statements and related certificates (P&L, balance sheet, tax documents). */
  TURNOVER,

  /** Purchase orders, contracts and completion certificates. */
  WORK_ORDER,

  /** No usable signal was available. */
  UNKNOWN;

  /**
   * Lenient parse used for vision hints. Accepts any casing and {@code -}/space separators.
   * Anything unrecognized, including the analyzer's {@code OTHER}, maps to {@link #UNKNOWN}.
   */
  @JsonCreator
  public static MainDocumentType fromValue(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    for (MainDocumentType type : values()) {
      if (type.name().equals(normalized)) {
        return type;
      }
    }
    return UNKNOWN;
  }
}
