package com.flamingo.ai.segmentation.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/** How much extractable data the vision analyzer saw on a page. */
public enum DataDensity {
  LOW,
  MEDIUM,
  HIGH;

  /** Missing or unrecognized values read as {@link #LOW}. */
  @JsonCreator
  public static DataDensity fromValue(String value) {
    if (value == null) {
      return LOW;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return LOW;
    }
  }
}
