package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.config.SegmentationConfig;
import com.flamingo.ai.segmentation.domain.enums.SegmentationMode;
import com.flamingo.ai.segmentation.exception.InvalidSegmentationRequestException;
import java.util.Objects;

/**
 * Per-run settings.
 *
 * @param mode how pages are cut into segments
 * @param mergeEnabled whether weak singletons are merged (SUBTYPE mode only)
 * @param mergeThreshold singleton merge threshold in [0,1]
 */
public record SegmentationOptions(
    SegmentationMode mode, boolean mergeEnabled, double mergeThreshold) {

  public SegmentationOptions {
    Objects.requireNonNull(mode, "mode");
    if (Double.isNaN(mergeThreshold) || mergeThreshold < 0.0 || mergeThreshold > 1.0) {
      throw new InvalidSegmentationRequestException(
          "Merge threshold out of range: " + mergeThreshold,
          "mergeThreshold must be between 0.0 and 1.0");
    }
  }

  public static SegmentationOptions from(SegmentationConfig config) {
    return new SegmentationOptions(
        config.getMode(), config.getMerge().isEnabled(), config.getMerge().getMinConfidence());
  }

  /** Copy with the non-null overrides applied. */
  public SegmentationOptions override(SegmentationMode newMode, Double newThreshold) {
    return new SegmentationOptions(
        newMode != null ? newMode : mode,
        mergeEnabled,
        newThreshold != null ? newThreshold : mergeThreshold);
  }
}
