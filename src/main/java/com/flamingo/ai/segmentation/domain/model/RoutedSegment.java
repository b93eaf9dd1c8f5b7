package com.flamingo.ai.segmentation.domain.model;

import com.flamingo.ai.segmentation.domain.enums.ConfidenceBand;

/**
 * A segment as handed to field extraction: the segment, its main-type classification and the
 * routing decision.
 *
 * @param segment the page range and its sub-type labelling
 * @param classification multi-factor main-type decision for the range
 * @param requiresExtraction from the eligibility table
 * @param priority from the eligibility table, lower first
 * @param band confidence bucket of the classification
 * @param needsReview classification is below the review threshold or the type is unknown
 * @param documentId first document id seen on the segment's pages, may be {@code null}
 * @param documentTitle first document title seen on the segment's pages, may be {@code null}
 */
public record RoutedSegment(
    Segment segment,
    ClassificationResult classification,
    boolean requiresExtraction,
    int priority,
    ConfidenceBand band,
    boolean needsReview,
    String documentId,
    String documentTitle) {}
