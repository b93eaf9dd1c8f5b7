package com.flamingo.ai.segmentation.domain.enums;

/** Strategy used to cut a page sequence into segments. */
public enum SegmentationMode {
  /** Group consecutive pages sharing a (main type, sub-type) pair, then merge weak singletons. */
  SUBTYPE,

  /** Cut wherever the vision analyzer flagged a page as the start of a new document. */
  BOUNDARY
}
