package com.flamingo.ai.segmentation.api.dto.response;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.model.ExtractionEligibility;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing the sub-type catalog and extraction routing. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogResponse {

  /** Catalog rows in evaluation order. */
  private List<CatalogEntry> subTypes;

  /** Routing per main type, keyed by sub-type label. */
  private Map<MainDocumentType, Map<String, ExtractionEligibility>> eligibility;

  /** One sub-type keyword list. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CatalogEntry {
    private String subType;
    private MainDocumentType mainType;
    private List<String> keywords;
  }
}
