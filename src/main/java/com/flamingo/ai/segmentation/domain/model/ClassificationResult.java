package com.flamingo.ai.segmentation.domain.model;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Main-type decision for one segment.
 *
 * @param documentType winning main type, {@link MainDocumentType#UNKNOWN} without valid data
 * @param confidence winning score divided by 100, or 0.5 for a tie
 * @param reasoning human-readable summary of the evidence
 * @param scores per-candidate total in [0,100]
 * @param tie whether the totals were equal and a tie-break decided
 * @param validPages number of pages in the segment that had usable data
 */
public record ClassificationResult(
    MainDocumentType documentType,
    double confidence,
    String reasoning,
    Map<MainDocumentType, Double> scores,
    boolean tie,
    int validPages) {

  public ClassificationResult {
    Objects.requireNonNull(documentType, "documentType");
    Objects.requireNonNull(reasoning, "reasoning");
    confidence = Math.max(0.0, Math.min(1.0, confidence));
    EnumMap<MainDocumentType, Double> copy = new EnumMap<>(MainDocumentType.class);
    if (scores != null) {
      copy.putAll(scores);
    }
    scores = Collections.unmodifiableMap(copy);
  }

  public static ClassificationResult noValidData() {
    EnumMap<MainDocumentType, Double> scores = new EnumMap<>(MainDocumentType.class);
    scores.put(MainDocumentType.WORK_ORDER, 0.0);
    scores.put(MainDocumentType.TURNOVER, 0.0);
    return new ClassificationResult(
        MainDocumentType.UNKNOWN, 0.0, "no valid page data", scores, false, 0);
  }

  public double scoreFor(MainDocumentType type) {
    return scores.getOrDefault(type, 0.0);
  }
}
