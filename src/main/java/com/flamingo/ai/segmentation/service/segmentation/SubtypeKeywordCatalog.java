package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.SubType;
import java.util.List;

/**
 * Keyword lists per sub-type, in the order the detector evaluates them. When two entries match the
 * same number of keywords the one declared first wins, so the order here is part of the behavior.
 *
 * <p>CA Certificate appears once per family with different keyword lists.
 */
public final class SubtypeKeywordCatalog {

  /**
   * One catalog row.
   *
   * @param subType the sub-type detected when this row wins
   * @param mainType the family this row belongs to
   * @param keywords lowercase keyword phrases, never empty
   */
  public record Entry(SubType subType, MainDocumentType mainType, List<String> keywords) {

    public Entry {
      keywords = List.copyOf(keywords);
      if (keywords.isEmpty()) {
        throw new IllegalArgumentException("Catalog entry without keywords: " + subType);
      }
    }

    public int keywordCount() {
      return keywords.size();
    }
  }

  private static final List<Entry> ENTRIES =
      List.of(
          new Entry(
              SubType.PL_STATEMENT,
              MainDocumentType.TURNOVER,
              List.of(
                  "profit and loss",
                  "p&l",
                  "statement of profit and loss",
                  "income statement",
                  "revenue from operations",
                  "expenses",
                  "profit for the year",
                  "loss for the year",
                  "total revenue",
                  "operating profit",
                  "net profit",
                  "ebitda")),
          new Entry(
              SubType.CA_CERTIFICATE,
              MainDocumentType.TURNOVER,
              List.of(
                  "chartered accountant",
                  "ca certificate",
                  "certification",
                  "certified that",
                  "examined",
                  "audit",
                  "icai",
                  "membership number",
                  "firm registration number",
                  "udin")),
          new Entry(
              SubType.BALANCE_SHEET,
              MainDocumentType.TURNOVER,
              List.of(
                  "balance sheet",
                  "financial position",
                  "assets",
                  "liabilities",
                  "equity and liabilities",
                  "shareholders funds",
                  "share capital",
                  "reserves and surplus",
                  "current assets",
                  "non-current assets",
                  "property plant and equipment")),
          new Entry(
              SubType.AUDITOR_REPORT,
              MainDocumentType.TURNOVER,
              List.of(
                  "auditor's report",
                  "independent auditor",
                  "audit opinion",
                  "audited financial statements",
                  "basis for opinion",
                  "key audit matters",
                  "material uncertainty",
                  "emphasis of matter")),
          new Entry(
              SubType.INCOME_TAX,
              MainDocumentType.TURNOVER,
              List.of(
                  "income tax",
                  "form 16",
                  "form 16a",
                  "tds certificate",
                  "tax deducted at source",
                  "tds",
                  "income tax return",
                  "itr",
                  "tax computation",
                  "advance tax",
                  "assessment year",
                  "pan")),
          new Entry(
              SubType.PURCHASE_ORDER,
              MainDocumentType.WORK_ORDER,
              List.of(
                  "purchase order",
                  "po#",
                  "order no",
                  "order number",
                  "vendor",
                  "supplier",
                  "buyer",
                  "delivery address",
                  "items",
                  "quantity",
                  "rate",
                  "amount",
                  "grand total",
                  "gstin",
                  "gst",
                  "invoice")),
          new Entry(
              SubType.COMPLETION_CERTIFICATE,
              MainDocumentType.WORK_ORDER,
              List.of(
                  "completion certificate",
                  "work completion",
                  "certificate of completion",
                  "completed work",
                  "satisfactory completion",
                  "work done",
                  "issued to",
                  "certified that the work")),
          new Entry(
              SubType.WORK_CONTRACT,
              MainDocumentType.WORK_ORDER,
              List.of(
                  "contract",
                  "agreement",
                  "contract agreement",
                  "party of the first part",
                  "party of the second part",
                  "contractor",
                  "contractee",
                  "terms and conditions",
                  "scope of work",
                  "contract value",
                  "contract period",
                  "penalty clause")),
          new Entry(
              SubType.STATEMENT_OF_WORK,
              MainDocumentType.WORK_ORDER,
              List.of(
                  "statement of work",
                  "sow",
                  "scope of work",
                  "work breakdown",
                  "deliverables",
                  "milestones",
                  "project scope",
                  "work description",
                  "tasks",
                  "activities",
                  "work items")),
          new Entry(
              SubType.CA_CERTIFICATE,
              MainDocumentType.WORK_ORDER,
              List.of(
                  "chartered accountant",
                  "ca certificate",
                  "certification",
                  "certified that",
                  "examined",
                  "work order",
                  "turnover certificate")));

  private SubtypeKeywordCatalog() {}

  public static List<Entry> entries() {
    return ENTRIES;
  }
}
