package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.PageKind;
import com.flamingo.ai.segmentation.domain.model.ClassificationResult;
import com.flamingo.ai.segmentation.domain.model.PageAnalysis;
import com.flamingo.ai.segmentation.domain.model.PageRange;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Weighted main-type scoring of a page range.
 *
 * <p>Four additive factors per candidate type, each total clamped to [0,100]:
 *
 * <ol>
 *   <li>type hints (40): share of valid pages hinting the type
 *   <li>keywords (30): share of all main-type keyword matches in the combined snippet text
 *   <li>structure (20): a certificate page for WORK_ORDER, financial wording for TURNOVER
 *   <li>layout flags (10): tables add 5 to both, forms add 5 to WORK_ORDER
 * </ol>
 *
 * <p>Equal totals go to the type with more hints; with equal hints WORK_ORDER wins at confidence
 * 0.5. Pages that do not resolve to an analysis are left out of every denominator.
 */
@Slf4j
@Service
public class MultiFactorClassifier {

  static final double HINT_WEIGHT = 40.0;
  static final double KEYWORD_WEIGHT = 30.0;
  static final double STRUCTURE_BONUS = 20.0;
  static final double LAYOUT_BONUS = 5.0;
  static final double TIE_CONFIDENCE = 0.5;
  static final double MAX_SCORE = 100.0;

  /**
   * Classifies a page range.
   *
   * @param range the segment's pages
   * @param lookup page lookup over the document's records
   * @return the decision; UNKNOWN with confidence 0.0 when no page in the range has data
   */
  public ClassificationResult classify(PageRange range, PageRecordLookup lookup) {
    List<PageAnalysis> valid = new ArrayList<>();
    for (int page : range.pages()) {
      Optional<PageAnalysis> analysis = lookup.lookup(page);
      analysis.ifPresent(valid::add);
    }

    log.debug("Classifying pages {}: {}/{} with data", range, valid.size(), range.size());

    if (valid.isEmpty()) {
      return ClassificationResult.noValidData();
    }

    // Factor 1: type hints
    int woHints = countHints(valid, MainDocumentType.WORK_ORDER);
    int turnoverHints = countHints(valid, MainDocumentType.TURNOVER);
    double woScore = HINT_WEIGHT * woHints / valid.size();
    double turnoverScore = HINT_WEIGHT * turnoverHints / valid.size();

    // Factor 2: keyword matching
    String combinedText = combinedText(valid);
    int woMatches = MainTypeKeywords.countMatches(MainDocumentType.WORK_ORDER, combinedText);
    int turnoverMatches = MainTypeKeywords.countMatches(MainDocumentType.TURNOVER, combinedText);
    int totalMatches = Math.max(woMatches + turnoverMatches, 1);
    woScore += KEYWORD_WEIGHT * woMatches / totalMatches;
    turnoverScore += KEYWORD_WEIGHT * turnoverMatches / totalMatches;

    // Factor 3: structural bonus
    boolean hasCertificate = valid.stream().anyMatch(p -> p.pageKind() == PageKind.CERTIFICATE);
    if (hasCertificate) {
      woScore += STRUCTURE_BONUS;
    }
    if (MainTypeKeywords.FINANCIAL_MARKERS.stream().anyMatch(combinedText::contains)) {
      turnoverScore += STRUCTURE_BONUS;
    }

    // Factor 4: document structure flags
    if (valid.stream().anyMatch(p -> p.structureFlags().hasTables())) {
      woScore += LAYOUT_BONUS;
      turnoverScore += LAYOUT_BONUS;
    }
    if (valid.stream().anyMatch(p -> p.structureFlags().hasForms())) {
      woScore += LAYOUT_BONUS;
    }

    woScore = clamp(woScore);
    turnoverScore = clamp(turnoverScore);

    Map<MainDocumentType, Double> scores = new EnumMap<>(MainDocumentType.class);
    scores.put(MainDocumentType.WORK_ORDER, woScore);
    scores.put(MainDocumentType.TURNOVER, turnoverScore);

    log.debug(
        "Pages {}: hints WO={} TURNOVER={}, keywords WO={} TURNOVER={}, scores WO={} TURNOVER={}",
        range,
        woHints,
        turnoverHints,
        woMatches,
        turnoverMatches,
        String.format("%.1f", woScore),
        String.format("%.1f", turnoverScore));

    if (woScore > turnoverScore) {
      return new ClassificationResult(
          MainDocumentType.WORK_ORDER,
          woScore / MAX_SCORE,
          buildReasoning(MainDocumentType.WORK_ORDER, woHints, woMatches, hasCertificate),
          scores,
          false,
          valid.size());
    }
    if (turnoverScore > woScore) {
      return new ClassificationResult(
          MainDocumentType.TURNOVER,
          turnoverScore / MAX_SCORE,
          buildReasoning(MainDocumentType.TURNOVER, turnoverHints, turnoverMatches, false),
          scores,
          false,
          valid.size());
    }
    return breakTie(woHints, turnoverHints, scores, valid.size());
  }

  private ClassificationResult breakTie(
      int woHints, int turnoverHints, Map<MainDocumentType, Double> scores, int validPages) {
    if (turnoverHints > woHints) {
      return new ClassificationResult(
          MainDocumentType.TURNOVER,
          TIE_CONFIDENCE,
          "tie on score; TURNOVER has more hints (" + turnoverHints + " vs " + woHints + ")",
          scores,
          true,
          validPages);
    }
    if (woHints > turnoverHints) {
      return new ClassificationResult(
          MainDocumentType.WORK_ORDER,
          TIE_CONFIDENCE,
          "tie on score; WORK_ORDER has more hints (" + woHints + " vs " + turnoverHints + ")",
          scores,
          true,
          validPages);
    }
    return new ClassificationResult(
        MainDocumentType.WORK_ORDER,
        TIE_CONFIDENCE,
        "tie on score and hints; defaulting to WORK_ORDER",
        scores,
        true,
        validPages);
  }

  private static String buildReasoning(
      MainDocumentType type, int hintCount, int keywordCount, boolean certificateBonus) {
    List<String> reasons = new ArrayList<>();
    if (hintCount > 0) {
      reasons.add("found " + hintCount + " hint(s) for " + type);
    }
    if (keywordCount > 0) {
      reasons.add(keywordCount + " keyword matches");
    }
    if (certificateBonus && type == MainDocumentType.WORK_ORDER) {
      reasons.add("contains certificate page");
    }
    if (reasons.isEmpty()) {
      reasons.add("pattern match for " + type + " document structure");
    }
    return String.join("; ", reasons);
  }

  private static int countHints(List<PageAnalysis> pages, MainDocumentType type) {
    return (int) pages.stream().filter(p -> p.hints(type)).count();
  }

  private static String combinedText(List<PageAnalysis> pages) {
    List<String> snippets = new ArrayList<>();
    for (PageAnalysis page : pages) {
      snippets.addAll(page.textSnippets());
    }
    return String.join(" ", snippets).toLowerCase(Locale.ROOT);
  }

  private static double clamp(double score) {
    return Math.max(0.0, Math.min(MAX_SCORE, score));
  }
}
