package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.domain.model.PageRecord;
import com.flamingo.ai.segmentation.domain.model.SegmentationResult;
import java.util.List;

/** Service interface for segmenting and classifying a multi-page document. */
public interface DocumentSegmentationService {

  /**
   * Segments a document with the configured defaults.
   *
   * @param pages page records from the vision analyzer, in document order
   * @return routed segments partitioning every page, plus a run summary
   */
  SegmentationResult segment(List<PageRecord> pages);

  /**
   * Segments a document with explicit options.
   *
   * @param pages page records from the vision analyzer, in document order
   * @param options mode and merge settings for this run
   * @return routed segments partitioning every page, plus a run summary
   */
  SegmentationResult segment(List<PageRecord> pages, SegmentationOptions options);

  /** Options built from configuration, used by {@link #segment(List)}. */
  SegmentationOptions defaultOptions();
}
