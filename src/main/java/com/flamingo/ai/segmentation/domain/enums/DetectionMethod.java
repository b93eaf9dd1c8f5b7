package com.flamingo.ai.segmentation.domain.enums;

/** How a page's sub-type assignment was obtained. */
public enum DetectionMethod {
  /** Keyword catalog produced at least one match. */
  KEYWORD,

  /** Main type was re-assigned from neighboring pages. */
  CONTEXT,

  /** Nothing matched or the page had no data. */
  NONE
}
