package com.flamingo.ai.segmentation.config;

import com.flamingo.ai.segmentation.domain.enums.SegmentationMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for page segmentation and classification. */
@Configuration
@ConfigurationProperties(prefix = "segmentation")
@Getter
@Setter
public class SegmentationConfig {

  /** Default strategy for cutting pages into segments; requests may override it. */
  private SegmentationMode mode = SegmentationMode.SUBTYPE;

  private Merge merge = new Merge();
  private Review review = new Review();
  private CrossType crossType = new CrossType();

  /** Singleton merge pass run after homogeneous segments are built. */
  @Getter
  @Setter
  public static class Merge {
    private boolean enabled = true;

    /** Single-page segments below this confidence are folded into a same-type predecessor. */
    private double minConfidence = 0.6;
  }

  @Getter
  @Setter
  public static class Review {
    /** Classifications below this confidence are flagged for human review. */
    private double minConfidence = 0.7;

    /** Classifications at or above this confidence are reported as HIGH. */
    private double highConfidence = 0.9;
  }

  @Getter
  @Setter
  public static class CrossType {
    /** Re-assign the main type of sub-types shared by both families from neighboring pages. */
    private boolean enabled = true;
  }
}
