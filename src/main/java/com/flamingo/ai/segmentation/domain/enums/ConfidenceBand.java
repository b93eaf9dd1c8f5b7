package com.flamingo.ai.segmentation.domain.enums;

/** Review bucket for a classification confidence. */
public enum ConfidenceBand {
  HIGH,
  MEDIUM,
  LOW;

  public static ConfidenceBand of(double confidence, double highThreshold, double reviewThreshold) {
    if (confidence >= highThreshold) {
      return HIGH;
    } else if (confidence >= reviewThreshold) {
      return MEDIUM;
    } else {
      return LOW;
    }
  }
}
