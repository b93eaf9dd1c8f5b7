package com.flamingo.ai.segmentation.api.dto.request;

import com.flamingo.ai.segmentation.domain.enums.SegmentationMode;
import com.flamingo.ai.segmentation.domain.model.PageRecord;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for segmenting a document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentationRequest {

  @NotEmpty(message = "At least one page record is required")
  private List<PageRecord> pages;

  /** Overrides the configured segmentation mode when set. */
  private SegmentationMode mode;

  /** Overrides the configured singleton merge threshold when set. */
  @DecimalMin(value = "0.0", message = "mergeThreshold must be at least 0.0")
  @DecimalMax(value = "1.0", message = "mergeThreshold must be at most 1.0")
  private Double mergeThreshold;
}
