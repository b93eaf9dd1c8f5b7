package com.flamingo.ai.segmentation.domain.model;

import com.flamingo.ai.segmentation.domain.enums.SegmentationMode;
import java.util.List;

/** Output of one segmentation run over a document. */
public record SegmentationResult(
    SegmentationMode mode, List<RoutedSegment> segments, SegmentationSummary summary) {

  public SegmentationResult {
    segments = List.copyOf(segments);
  }
}
