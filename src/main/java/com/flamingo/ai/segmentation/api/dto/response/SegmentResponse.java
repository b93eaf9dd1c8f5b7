package com.flamingo.ai.segmentation.api.dto.response;

import com.flamingo.ai.segmentation.domain.enums.ConfidenceBand;
import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.model.RoutedSegment;
import com.flamingo.ai.segmentation.domain.model.Segment;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one routed segment. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentResponse {

  private int segmentId;
  private int startPage;
  private int endPage;
  private List<Integer> pages;
  private MainDocumentType mainType;
  private String subType;
  private double confidence;
  private MainDocumentType documentType;
  private double classificationConfidence;
  private String reasoning;
  private Map<MainDocumentType, Double> scores;
  private boolean requiresExtraction;
  private int priority;
  private ConfidenceBand confidenceBand;
  private boolean needsReview;
  private String documentId;
  private String documentTitle;

  /** Creates a SegmentResponse from a routed segment. */
  public static SegmentResponse fromRoutedSegment(RoutedSegment routed) {
    Segment segment = routed.segment();
    return SegmentResponse.builder()
        .segmentId(segment.segmentId())
        .startPage(segment.startPage())
        .endPage(segment.endPage())
        .pages(segment.pages())
        .mainType(segment.mainType())
        .subType(segment.subTypeLabel())
        .confidence(segment.confidence())
        .documentType(routed.classification().documentType())
        .classificationConfidence(routed.classification().confidence())
        .reasoning(routed.classification().reasoning())
        .scores(routed.classification().scores())
        .requiresExtraction(routed.requiresExtraction())
        .priority(routed.priority())
        .confidenceBand(routed.band())
        .needsReview(routed.needsReview())
        .documentId(routed.documentId())
        .documentTitle(routed.documentTitle())
        .build();
  }
}
