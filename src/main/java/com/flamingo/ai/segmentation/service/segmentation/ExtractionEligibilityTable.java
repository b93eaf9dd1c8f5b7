package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.SubType;
import com.flamingo.ai.segmentation.domain.model.ExtractionEligibility;
import com.flamingo.ai.segmentation.domain.model.Segment;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Which (main type, sub-type) pairs go to field extraction, and in what priority.
 *
 * <p>Pairs not listed are not extracted and get priority {@value
 * ExtractionEligibility#UNLISTED_PRIORITY}.
 */
@Component
public class ExtractionEligibilityTable {

  private static final Map<MainDocumentType, Map<SubType, ExtractionEligibility>> TABLE;

  static {
    Map<SubType, ExtractionEligibility> turnover = new EnumMap<>(SubType.class);
    turnover.put(SubType.PL_STATEMENT, new ExtractionEligibility(true, 1));
    turnover.put(SubType.CA_CERTIFICATE, new ExtractionEligibility(true, 2));
    turnover.put(SubType.BALANCE_SHEET, new ExtractionEligibility(false, 3));
    turnover.put(SubType.AUDITOR_REPORT, new ExtractionEligibility(false, 4));
    turnover.put(SubType.INCOME_TAX, new ExtractionEligibility(false, 5));
    turnover.put(SubType.OTHER, new ExtractionEligibility(false, 10));

    Map<SubType, ExtractionEligibility> workOrder = new EnumMap<>(SubType.class);
    workOrder.put(SubType.PURCHASE_ORDER, new ExtractionEligibility(true, 1));
    workOrder.put(SubType.COMPLETION_CERTIFICATE, new ExtractionEligibility(true, 2));
    workOrder.put(SubType.WORK_CONTRACT, new ExtractionEligibility(true, 2));
    workOrder.put(SubType.STATEMENT_OF_WORK, new ExtractionEligibility(true, 2));
    workOrder.put(SubType.CA_CERTIFICATE, new ExtractionEligibility(true, 2));
    workOrder.put(SubType.OTHER, new ExtractionEligibility(false, 10));

    Map<MainDocumentType, Map<SubType, ExtractionEligibility>> table =
        new EnumMap<>(MainDocumentType.class);
    table.put(MainDocumentType.TURNOVER, Collections.unmodifiableMap(turnover));
    table.put(MainDocumentType.WORK_ORDER, Collections.unmodifiableMap(workOrder));
    TABLE = Collections.unmodifiableMap(table);
  }

  public ExtractionEligibility lookup(MainDocumentType mainType, SubType subType) {
    return TABLE
        .getOrDefault(mainType, Map.of())
        .getOrDefault(subType, ExtractionEligibility.unlisted());
  }

  /**
   * Routing for a segment. A merged segment ({@code "A + B"}) requires extraction when any
   * constituent does, at the best constituent priority.
   */
  public ExtractionEligibility lookup(Segment segment) {
    boolean requires = false;
    int priority = ExtractionEligibility.UNLISTED_PRIORITY;
    for (SubType subType : segment.subTypes()) {
      ExtractionEligibility eligibility = lookup(segment.mainType(), subType);
      requires |= eligibility.requiresExtraction();
      priority = Math.min(priority, eligibility.priority());
    }
    return new ExtractionEligibility(requires, priority);
  }

  /** The full table, for publishing to downstream consumers. */
  public Map<MainDocumentType, Map<SubType, ExtractionEligibility>> asMap() {
    return TABLE;
  }
}
