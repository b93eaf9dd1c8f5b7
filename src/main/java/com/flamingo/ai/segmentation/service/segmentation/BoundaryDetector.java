package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.domain.model.PageAnalysis;
import com.flamingo.ai.segmentation.domain.model.PageRange;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cuts a document into page ranges at pages the vision analyzer flagged as a new document start.
 *
 * <p>Pages are scanned in increasing page-number order carrying a single "current start" cursor.
 * Page 1 always opens the first range; a page without usable data never opens a range and stays
 * attached to the open one. The resulting ranges partition {@code [1..N]}.
 */
@Slf4j
@Component
public class BoundaryDetector {

  /**
   * Detects document boundaries.
   *
   * @param lookup page lookup over the document's records
   * @return ordered, non-overlapping ranges covering every page; empty for an empty document
   */
  public List<PageRange> detect(PageRecordLookup lookup) {
    int pageCount = lookup.pageCount();
    List<PageRange> boundaries = new ArrayList<>();
    if (pageCount == 0) {
      return boundaries;
    }

    int currentStart = 1;
    for (int page = 2; page <= pageCount; page++) {
      boolean startsDocument = lookup.lookup(page).map(PageAnalysis::segmentStart).orElse(false);
      if (startsDocument) {
        boundaries.add(new PageRange(currentStart, page - 1));
        currentStart = page;
      }
    }
    boundaries.add(new PageRange(currentStart, pageCount));

    log.debug(
        "Detected {} boundary range(s) over {} page(s): {}",
        boundaries.size(),
        pageCount,
        boundaries);
    return boundaries;
  }
}
