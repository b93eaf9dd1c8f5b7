package com.flamingo.ai.segmentation.domain.model;

import java.util.List;
import java.util.stream.IntStream;

/** Inclusive, 1-based range of page numbers. */
public record PageRange(int startPage, int endPage) {

  public PageRange {
    if (startPage < 1 || endPage < startPage) {
      throw new IllegalArgumentException(
          "Invalid page range: " + startPage + "-" + endPage);
    }
  }

  public List<Integer> pages() {
    return IntStream.rangeClosed(startPage, endPage).boxed().toList();
  }

  public int size() {
    return endPage - startPage + 1;
  }

  public boolean contains(int pageNumber) {
    return pageNumber >= startPage && pageNumber <= endPage;
  }

  @Override
  public String toString() {
    return startPage == endPage ? String.valueOf(startPage) : startPage + "-" + endPage;
  }
}
