package com.flamingo.ai.segmentation.api.dto.response;

import com.flamingo.ai.segmentation.domain.enums.SegmentationMode;
import com.flamingo.ai.segmentation.domain.model.SegmentationResult;
import com.flamingo.ai.segmentation.domain.model.SegmentationSummary;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a segmentation run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentationResponse {

  private SegmentationMode mode;
  private List<SegmentResponse> segments;
  private SegmentationSummary summary;

  /** Creates a SegmentationResponse from a segmentation result. */
  public static SegmentationResponse fromResult(SegmentationResult result) {
    return SegmentationResponse.builder()
        .mode(result.mode())
        .segments(result.segments().stream().map(SegmentResponse::fromRoutedSegment).toList())
        .summary(result.summary())
        .build();
  }
}
