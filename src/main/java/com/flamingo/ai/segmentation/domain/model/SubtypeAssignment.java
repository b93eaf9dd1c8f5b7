package com.flamingo.ai.segmentation.domain.model;

import com.flamingo.ai.segmentation.domain.enums.DetectionMethod;
import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.SubType;
import java.util.Objects;

/**
 * Main type and sub-type detected for a page (or a run of pages).
 *
 * @param mainType main document family
 * @param subType specific document kind, {@link SubType#UNKNOWN} when nothing matched
 * @param confidence detection confidence in [0,1]
 * @param method how the assignment was produced
 */
public record SubtypeAssignment(
    MainDocumentType mainType, SubType subType, double confidence, DetectionMethod method) {

  private static final SubtypeAssignment UNKNOWN =
      new SubtypeAssignment(MainDocumentType.UNKNOWN, SubType.UNKNOWN, 0.0, DetectionMethod.NONE);

  public SubtypeAssignment {
    Objects.requireNonNull(mainType, "mainType");
    Objects.requireNonNull(subType, "subType");
    Objects.requireNonNull(method, "method");
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  public static SubtypeAssignment unknown() {
    return UNKNOWN;
  }

  /** Same sub-type and confidence under a main type decided from context. */
  public SubtypeAssignment withContextMainType(MainDocumentType resolved) {
    if (resolved == mainType) {
      return this;
    }
    return new SubtypeAssignment(resolved, subType, confidence, DetectionMethod.CONTEXT);
  }

  /** True when both assignments put the page in the same (main type, sub-type) bucket. */
  public boolean sameBucket(SubtypeAssignment other) {
    return other != null && mainType == other.mainType && subType == other.subType;
  }
}
