package com.flamingo.ai.segmentation.domain.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A page position together with its resolved analysis (if any) and sub-type assignment.
 *
 * @param pageNumber 1-based position in the document
 * @param analysis resolved payload, {@code null} when the page has no usable data
 * @param assignment sub-type annotation
 */
public record AnnotatedPage(int pageNumber, PageAnalysis analysis, SubtypeAssignment assignment) {

  public AnnotatedPage {
    if (pageNumber < 1) {
      throw new IllegalArgumentException("pageNumber must be positive: " + pageNumber);
    }
    Objects.requireNonNull(assignment, "assignment");
  }

  public Optional<PageAnalysis> findAnalysis() {
    return Optional.ofNullable(analysis);
  }

  public boolean hasData() {
    return analysis != null;
  }

  public AnnotatedPage withAssignment(SubtypeAssignment newAssignment) {
    return new AnnotatedPage(pageNumber, analysis, newAssignment);
  }
}
