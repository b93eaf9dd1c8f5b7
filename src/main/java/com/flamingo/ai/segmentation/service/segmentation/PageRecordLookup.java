package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.domain.model.PageAnalysis;
import com.flamingo.ai.segmentation.domain.model.PageRecord;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tolerant lookup of a page's analysis by 1-based page number.
 *
 * <p>Page records may arrive out of order or with inconsistent numbering. Resolution order, first
 * match wins:
 *
 * <ol>
 *   <li>a succeeded record whose declared {@code page_number} equals the requested number
 *   <li>the record at position {@code pageNumber - 1}, if it succeeded
 *   <li>a succeeded record whose payload carries the requested page number
 * </ol>
 *
 * <p>No match yields {@link Optional#empty()}; lookup never throws for missing data.
 */
public final class PageRecordLookup {

  private final List<PageRecord> records;
  private final Map<Integer, PageAnalysis> byDeclaredNumber = new HashMap<>();
  private final Map<Integer, PageAnalysis> byPayloadNumber = new HashMap<>();

  private PageRecordLookup(List<PageRecord> records) {
    this.records = records;
    for (PageRecord record : records) {
      record
          .analysis()
          .ifPresent(
              analysis -> {
                if (record.pageNumber() != null) {
                  byDeclaredNumber.putIfAbsent(record.pageNumber(), analysis);
                }
                if (analysis.pageNumber() != null) {
                  byPayloadNumber.putIfAbsent(analysis.pageNumber(), analysis);
                }
              });
    }
  }

  public static PageRecordLookup of(List<PageRecord> records) {
    Objects.requireNonNull(records, "records");
    return new PageRecordLookup(records.stream().filter(Objects::nonNull).toList());
  }

  /**
   * Resolves the analysis for a page.
   *
   * @param pageNumber 1-based page number
   * @return the payload, or empty when no strategy matches
   */
  public Optional<PageAnalysis> lookup(int pageNumber) {
    PageAnalysis exact = byDeclaredNumber.get(pageNumber);
    if (exact != null) {
      return Optional.of(exact);
    }

    int index = pageNumber - 1;
    if (index >= 0 && index < records.size()) {
      Optional<PageAnalysis> positional = records.get(index).analysis();
      if (positional.isPresent()) {
        return positional;
      }
    }

    return Optional.ofNullable(byPayloadNumber.get(pageNumber));
  }

  /** Number of pages in the document, taken as the number of records received. */
  public int pageCount() {
    return records.size();
  }

  /** Number of pages in {@code [1..pageCount]} that resolve to an analysis. */
  public int resolvablePageCount() {
    int count = 0;
    for (int page = 1; page <= pageCount(); page++) {
      if (lookup(page).isPresent()) {
        count++;
      }
    }
    return count;
  }
}
