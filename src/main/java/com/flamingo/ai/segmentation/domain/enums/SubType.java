package com.flamingo.ai.segmentation.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Specific document kind within a {@link MainDocumentType} family.
 *
 * <p>{@link #CA_CERTIFICATE} is the only sub-type that belongs to both families; its main type is
 * decided from context (see {@code CrossTypeContextResolver}).
 */
public enum SubType {
  PL_STATEMENT("P&L Statement", EnumSet.of(MainDocumentType.TURNOVER)),
  BALANCE_SHEET("Balance Sheet", EnumSet.of(MainDocumentType.TURNOVER)),
  CA_CERTIFICATE(
      "CA Certificate", EnumSet.of(MainDocumentType.TURNOVER, MainDocumentType.WORK_ORDER)),
  AUDITOR_REPORT("Auditor's Report", EnumSet.of(MainDocumentType.TURNOVER)),
  INCOME_TAX("Income Tax Related", EnumSet.of(MainDocumentType.TURNOVER)),
  PURCHASE_ORDER("Purchase Order", EnumSet.of(MainDocumentType.WORK_ORDER)),
  COMPLETION_CERTIFICATE("Completion Certificate", EnumSet.of(MainDocumentType.WORK_ORDER)),
  WORK_CONTRACT("Work Contract", EnumSet.of(MainDocumentType.WORK_ORDER)),
  STATEMENT_OF_WORK("Statement of Work", EnumSet.of(MainDocumentType.WORK_ORDER)),
  OTHER("Other", EnumSet.of(MainDocumentType.TURNOVER, MainDocumentType.WORK_ORDER)),
  UNKNOWN("Unknown", EnumSet.noneOf(MainDocumentType.class));

  private final String label;
  private final Set<MainDocumentType> families;

  SubType(String label, Set<MainDocumentType> families) {
    this.label = label;
    this.families = families;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public Set<MainDocumentType> getFamilies() {
    return Collections.unmodifiableSet(families);
  }

  /** True when both main-type families use the sub-type, so keywords alone are ambiguous. */
  public boolean isCrossType() {
    return this != OTHER && families.size() > 1;
  }

  /** Finds a sub-type by its display label, e.g. {@code "Purchase Order"}. */
  public static SubType fromLabel(String label) {
    if (label == null) {
      return UNKNOWN;
    }
    for (SubType subType : values()) {
      if (subType.label.equalsIgnoreCase(label.trim())) {
        return subType;
      }
    }
    return UNKNOWN;
  }
}
