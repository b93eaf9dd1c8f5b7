package com.flamingo.ai.segmentation.domain.model;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.SubType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A contiguous run of pages carrying one main type and one sub-type label.
 *
 * <p>{@code subTypeLabel} is the display label of the single sub-type, or {@code "A + B"} when a
 * weak singleton was merged into its predecessor; {@code subTypes} keeps the constituents in page
 * order.
 *
 * @param segmentId sequential, 1-based id within one document
 * @param startPage first page, inclusive
 * @param endPage last page, inclusive
 * @param pages exactly {@code [startPage..endPage]}
 * @param mainType main document family
 * @param subTypeLabel sub-type label as reported downstream
 * @param subTypes constituent sub-types
 * @param confidence segment confidence in [0,1]
 */
public record Segment(
    int segmentId,
    int startPage,
    int endPage,
    List<Integer> pages,
    MainDocumentType mainType,
    String subTypeLabel,
    List<SubType> subTypes,
    double confidence) {

  public Segment {
    PageRange range = new PageRange(startPage, endPage);
    pages = List.copyOf(pages);
    if (!pages.equals(range.pages())) {
      throw new IllegalArgumentException(
          "Segment pages " + pages + " do not match range " + range);
    }
    Objects.requireNonNull(mainType, "mainType");
    Objects.requireNonNull(subTypeLabel, "subTypeLabel");
    subTypes = List.copyOf(subTypes);
    confidence = Math.max(0.0, Math.min(1.0, confidence));
  }

  /** Single sub-type segment over {@code range}. */
  public static Segment of(
      int segmentId,
      PageRange range,
      MainDocumentType mainType,
      SubType subType,
      double confidence) {
    return new Segment(
        segmentId,
        range.startPage(),
        range.endPage(),
        range.pages(),
        mainType,
        subType.getLabel(),
        List.of(subType),
        confidence);
  }

  public PageRange toRange() {
    return new PageRange(startPage, endPage);
  }

  public boolean isSinglePage() {
    return startPage == endPage;
  }

  public int pageCount() {
    return pages.size();
  }

  public Segment withSegmentId(int newId) {
    return new Segment(
        newId, startPage, endPage, pages, mainType, subTypeLabel, subTypes, confidence);
  }

  /**
   * Extends this segment with the directly following {@code next} segment. The label becomes {@code
   * "<this> + <next>"}; main type and confidence stay those of this segment.
   */
  public Segment absorb(Segment next) {
    if (next.startPage != endPage + 1) {
      throw new IllegalArgumentException(
          "Segment " + next.toRange() + " does not directly follow " + toRange());
    }
    List<Integer> mergedPages = new ArrayList<>(pages);
    mergedPages.addAll(next.pages);
    List<SubType> mergedSubTypes = new ArrayList<>(subTypes);
    mergedSubTypes.addAll(next.subTypes);
    return new Segment(
        segmentId,
        startPage,
        next.endPage,
        mergedPages,
        mainType,
        subTypeLabel + " + " + next.subTypeLabel,
        mergedSubTypes,
        confidence);
  }
}
