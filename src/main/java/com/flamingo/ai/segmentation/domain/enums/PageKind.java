package com.flamingo.ai.segmentation.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

/** Layout role of a page as reported by the vision analyzer. */
public enum PageKind {
  /** Cover page with the main title. */
  TITLE_PAGE,

  /** Contains extractable business data (tables, forms, key values). */
  DATA_PAGE,

  /** Blank or separator page between documents. */
  SEPARATOR,

  /** Table of contents. */
  TOC,

  /** Middle of a multi-page document. */
  CONTINUATION,

  /** Last page, usually carrying a signature. */
  END_PAGE,

  /** Magazine or brochure layout. */
  MAGAZINE_LAYOUT,

  /** Completion or achievement certificate. */
  CERTIFICATE,

  /** Kind was missing or not recognized. */
  UNKNOWN;

  /** Accepts {@code "title_page"}, {@code "TITLE_PAGE"} and the short forms ({@code "title"}). */
  @JsonCreator
  public static PageKind fromValue(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    switch (normalized) {
      case "TITLE":
        return TITLE_PAGE;
      case "DATA":
        return DATA_PAGE;
      case "END":
        return END_PAGE;
      case "MAGAZINE":
        return MAGAZINE_LAYOUT;
      default:
        break;
    }
    for (PageKind kind : values()) {
      if (kind.name().equals(normalized)) {
        return kind;
      }
    }
    return UNKNOWN;
  }
}
