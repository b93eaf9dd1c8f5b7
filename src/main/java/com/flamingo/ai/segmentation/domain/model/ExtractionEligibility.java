package com.flamingo.ai.segmentation.domain.model;

/**
 * Downstream routing for a (main type, sub-type) pair.
 *
 * @param requiresExtraction whether field extraction should run on the segment
 * @param priority processing priority, lower is more important
 */
public record ExtractionEligibility(boolean requiresExtraction, int priority) {

  public static final int UNLISTED_PRIORITY = 99;

  public static ExtractionEligibility unlisted() {
    return new ExtractionEligibility(false, UNLISTED_PRIORITY);
  }
}
