package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import java.util.List;

/** Keywords the multi-factor classifier counts for each main type. */
public final class MainTypeKeywords {

  static final List<String> WORK_ORDER =
      List.of(
          "work order",
          "purchase order",
          "po#",
          "wo#",
          "order no",
          "invoice",
          "delivery address",
          "vendor",
          "supplier",
          "gstin",
          "gst",
          "items",
          "quantity",
          "rate",
          "amount",
          "completion certificate",
          "job order");

  static final List<String> TURNOVER =
      List.of(
          "turnover",
          "revenue",
          "profit and loss",
          "p&l",
          "income statement",
          "balance sheet",
          "financial statement",
          "shareholders",
          "revenue from operations",
          "total revenue",
          "total income",
          "expenses",
          "profit",
          "loss",
          "fiscal year",
          "fy");

  /** Phrases whose presence gives TURNOVER the structural bonus. */
  static final List<String> FINANCIAL_MARKERS = List.of("financial", "balance", "profit and loss");

  private MainTypeKeywords() {}

  public static List<String> forType(MainDocumentType type) {
    switch (type) {
      case WORK_ORDER:
        return WORK_ORDER;
      case TURNOVER:
        return TURNOVER;
      default:
        return List.of();
    }
  }

  /** Number of distinct keywords of {@code type} that occur in {@code lowercaseText}. */
  public static int countMatches(MainDocumentType type, String lowercaseText) {
    return (int) forType(type).stream().filter(lowercaseText::contains).count();
  }
}
