package com.flamingo.ai.segmentation.domain.model;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Run-level counts reported alongside the routed segments. */
public record SegmentationSummary(
    int totalPages,
    int succeededPages,
    int failedPages,
    int segmentCount,
    Map<MainDocumentType, Integer> documentTypeCounts,
    double averageConfidence,
    int segmentsNeedingReview) {

  public SegmentationSummary {
    EnumMap<MainDocumentType, Integer> counts = new EnumMap<>(MainDocumentType.class);
    counts.putAll(documentTypeCounts);
    documentTypeCounts = Collections.unmodifiableMap(counts);
  }
}
