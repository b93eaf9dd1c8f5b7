package com.flamingo.ai.segmentation.api.rest;

import com.flamingo.ai.segmentation.api.dto.request.SegmentationRequest;
import com.flamingo.ai.segmentation.api.dto.request.SubtypeRequest;
import com.flamingo.ai.segmentation.api.dto.response.CatalogResponse;
import com.flamingo.ai.segmentation.api.dto.response.SegmentationResponse;
import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.SubType;
import com.flamingo.ai.segmentation.domain.model.ExtractionEligibility;
import com.flamingo.ai.segmentation.domain.model.SegmentationResult;
import com.flamingo.ai.segmentation.domain.model.SubtypeAssignment;
import com.flamingo.ai.segmentation.service.segmentation.DocumentSegmentationService;
import com.flamingo.ai.segmentation.service.segmentation.ExtractionEligibilityTable;
import com.flamingo.ai.segmentation.service.segmentation.SegmentationOptions;
import com.flamingo.ai.segmentation.service.segmentation.SubtypeDetector;
import com.flamingo.ai.segmentation.service.segmentation.SubtypeKeywordCatalog;
import jakarta.validation.Valid;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document segmentation. */
@RestController
@RequestMapping("/api/segmentation")
@RequiredArgsConstructor
public class SegmentationController {

  private final DocumentSegmentationService segmentationService;
  private final SubtypeDetector subtypeDetector;
  private final ExtractionEligibilityTable eligibilityTable;

  /** Segments and classifies a document's page records. */
  @PostMapping
  public ResponseEntity<SegmentationResponse> segment(
      @Valid @RequestBody SegmentationRequest request) {
    SegmentationOptions options =
        segmentationService
            .defaultOptions()
            .override(request.getMode(), request.getMergeThreshold());
    SegmentationResult result = segmentationService.segment(request.getPages(), options);
    return ResponseEntity.ok(SegmentationResponse.fromResult(result));
  }

  /** Detects the sub-type of a block of text snippets. */
  @PostMapping("/subtype")
  public ResponseEntity<SubtypeAssignment> detectSubtype(
      @Valid @RequestBody SubtypeRequest request) {
    return ResponseEntity.ok(subtypeDetector.detect(request.getSnippets()));
  }

  /** Returns the sub-type catalog and the extraction routing table. */
  @GetMapping("/catalog")
  public ResponseEntity<CatalogResponse> catalog() {
    List<CatalogResponse.CatalogEntry> entries =
        SubtypeKeywordCatalog.entries().stream()
            .map(
                entry ->
                    CatalogResponse.CatalogEntry.builder()
                        .subType(entry.subType().getLabel())
                        .mainType(entry.mainType())
                        .keywords(entry.keywords())
                        .build())
            .toList();

    Map<MainDocumentType, Map<String, ExtractionEligibility>> eligibility =
        new EnumMap<>(MainDocumentType.class);
    eligibilityTable
        .asMap()
        .forEach(
            (mainType, bySubType) -> {
              Map<String, ExtractionEligibility> labelled = new LinkedHashMap<>();
              for (Map.Entry<SubType, ExtractionEligibility> row : bySubType.entrySet()) {
                labelled.put(row.getKey().getLabel(), row.getValue());
              }
              eligibility.put(mainType, labelled);
            });

    return ResponseEntity.ok(
        CatalogResponse.builder().subTypes(entries).eligibility(eligibility).build());
  }
}
