package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.domain.enums.DetectionMethod;
import com.flamingo.ai.segmentation.domain.model.AnnotatedPage;
import com.flamingo.ai.segmentation.domain.model.PageAnalysis;
import com.flamingo.ai.segmentation.domain.model.SubtypeAssignment;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keyword-frequency sub-type detection.
 *
 * <p>For every {@link SubtypeKeywordCatalog} entry, counts how many of its keyword phrases occur in
 * the lowercased text. The entry with the most matches wins, earlier entries winning ties.
 * Confidence is {@code matches / (keywords * 0.3)} capped at 1.0 and floored at 0.3, so any
 * positive match is at least "fair".
 */
@Slf4j
@Component
public class SubtypeDetector {

  static final double FULL_CONFIDENCE_MATCH_RATIO = 0.3;
  static final double MIN_MATCH_CONFIDENCE = 0.3;

  /**
   * Detects the sub-type of a block of text snippets.
   *
   * @param snippets text fragments, may be empty
   * @return the assignment, {@link SubtypeAssignment#unknown()} when nothing matched
   */
  public SubtypeAssignment detect(Collection<String> snippets) {
    if (snippets == null || snippets.isEmpty()) {
      return SubtypeAssignment.unknown();
    }
    String text = String.join(" ", snippets).toLowerCase(Locale.ROOT);

    SubtypeKeywordCatalog.Entry best = null;
    int bestMatches = 0;
    for (SubtypeKeywordCatalog.Entry entry : SubtypeKeywordCatalog.entries()) {
      int matches = countMatches(entry, text);
      if (matches > bestMatches) {
        best = entry;
        bestMatches = matches;
      }
    }

    if (best == null) {
      return SubtypeAssignment.unknown();
    }

    double confidence =
        Math.min(bestMatches / (best.keywordCount() * FULL_CONFIDENCE_MATCH_RATIO), 1.0);
    confidence = Math.max(confidence, MIN_MATCH_CONFIDENCE);

    return new SubtypeAssignment(
        best.mainType(), best.subType(), confidence, DetectionMethod.KEYWORD);
  }

  /** Detects the sub-type of a single page's snippets. */
  public SubtypeAssignment detect(PageAnalysis analysis) {
    return analysis == null ? SubtypeAssignment.unknown() : detect(analysis.textSnippets());
  }

  /**
   * Annotates every page position {@code 1..pageCount} of the document. Pages without usable data
   * are annotated as unknown so the page sequence stays complete.
   */
  public List<AnnotatedPage> annotate(PageRecordLookup lookup) {
    List<AnnotatedPage> pages = new ArrayList<>(lookup.pageCount());
    for (int pageNumber = 1; pageNumber <= lookup.pageCount(); pageNumber++) {
      PageAnalysis analysis = lookup.lookup(pageNumber).orElse(null);
      SubtypeAssignment assignment = detect(analysis);
      log.debug(
          "Page {}: {} / {} (confidence={})",
          pageNumber,
          assignment.mainType(),
          assignment.subType().getLabel(),
          String.format("%.2f", assignment.confidence()));
      pages.add(new AnnotatedPage(pageNumber, analysis, assignment));
    }
    return pages;
  }

  private static int countMatches(SubtypeKeywordCatalog.Entry entry, String text) {
    int matches = 0;
    for (String keyword : entry.keywords()) {
      if (text.contains(keyword)) {
        matches++;
      }
    }
    return matches;
  }
}
