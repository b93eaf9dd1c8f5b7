package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.config.SegmentationConfig;
import com.flamingo.ai.segmentation.domain.enums.ConfidenceBand;
import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.SegmentationMode;
import com.flamingo.ai.segmentation.domain.model.AnnotatedPage;
import com.flamingo.ai.segmentation.domain.model.ClassificationResult;
import com.flamingo.ai.segmentation.domain.model.ExtractionEligibility;
import com.flamingo.ai.segmentation.domain.model.PageAnalysis;
import com.flamingo.ai.segmentation.domain.model.PageIdentifiers;
import com.flamingo.ai.segmentation.domain.model.PageRange;
import com.flamingo.ai.segmentation.domain.model.PageRecord;
import com.flamingo.ai.segmentation.domain.model.RoutedSegment;
import com.flamingo.ai.segmentation.domain.model.Segment;
import com.flamingo.ai.segmentation.domain.model.SegmentationResult;
import com.flamingo.ai.segmentation.domain.model.SegmentationSummary;
import com.flamingo.ai.segmentation.domain.model.SubtypeAssignment;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the DocumentSegmentationService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentSegmentationServiceImpl implements DocumentSegmentationService {

  private final SegmentationConfig segmentationConfig;
  private final SubtypeDetector subtypeDetector;
  private final BoundaryDetector boundaryDetector;
  private final MultiFactorClassifier classifier;
  private final HomogeneousSegmentBuilder segmentBuilder;
  private final CrossTypeContextResolver crossTypeResolver;
  private final ExtractionEligibilityTable eligibilityTable;
  private final MeterRegistry meterRegistry;

  @Override
  public SegmentationOptions defaultOptions() {
    return SegmentationOptions.from(segmentationConfig);
  }

  @Override
  public SegmentationResult segment(List<PageRecord> pages) {
    return segment(pages, defaultOptions());
  }

  @Override
  @Timed(value = "segmentation.run", description = "Time to segment and classify a document")
  public SegmentationResult segment(List<PageRecord> pages, SegmentationOptions options) {
    Objects.requireNonNull(pages, "pages");
    Objects.requireNonNull(options, "options");

    PageRecordLookup lookup = PageRecordLookup.of(pages);
    int totalPages = lookup.pageCount();
    int succeededPages = lookup.resolvablePageCount();
    log.info(
        "Segmenting {} page(s) ({} with data) in {} mode",
        totalPages,
        succeededPages,
        options.mode());
    if (totalPages > succeededPages) {
      log.warn("{} page(s) have no usable analysis", totalPages - succeededPages);
      meterRegistry.counter("segmentation.pages.failed").increment(totalPages - succeededPages);
    }

    List<PageRange> boundaries = boundaryDetector.detect(lookup);
    List<Segment> segments =
        options.mode() == SegmentationMode.BOUNDARY
            ? boundarySegments(boundaries, lookup)
            : subtypeSegments(boundaries, lookup, options);

    List<RoutedSegment> routed = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      routed.add(route(segment, lookup));
    }

    SegmentationSummary summary = summarize(totalPages, succeededPages, routed);
    log.info(
        "Produced {} segment(s): {} ({} need review)",
        summary.segmentCount(),
        summary.documentTypeCounts(),
        summary.segmentsNeedingReview());
    return new SegmentationResult(options.mode(), routed, summary);
  }

  private List<Segment> subtypeSegments(
      List<PageRange> boundaries, PageRecordLookup lookup, SegmentationOptions options) {
    List<AnnotatedPage> annotated = subtypeDetector.annotate(lookup);
    if (segmentationConfig.getCrossType().isEnabled()) {
      annotated = crossTypeResolver.resolveAll(annotated, boundaries);
    }

    List<Segment> segments = segmentBuilder.build(annotated);
    if (options.mergeEnabled()) {
      int before = segments.size();
      segments = segmentBuilder.mergeSinglePageSegments(segments, options.mergeThreshold());
      if (before > segments.size()) {
        meterRegistry.counter("segmentation.segments.merged").increment(before - segments.size());
      }
    }
    return segments;
  }

  /** One segment per boundary range, sub-type detected over the range's combined snippets. */
  private List<Segment> boundarySegments(List<PageRange> boundaries, PageRecordLookup lookup) {
    List<Segment> segments = new ArrayList<>(boundaries.size());
    for (PageRange range : boundaries) {
      List<String> snippets = new ArrayList<>();
      for (int page : range.pages()) {
        lookup.lookup(page).ifPresent(analysis -> snippets.addAll(analysis.textSnippets()));
      }
      SubtypeAssignment assignment = subtypeDetector.detect(snippets);
      segments.add(
          Segment.of(
              segments.size() + 1,
              range,
              assignment.mainType(),
              assignment.subType(),
              assignment.confidence()));
    }
    return segments;
  }

  private RoutedSegment route(Segment segment, PageRecordLookup lookup) {
    ClassificationResult classification = classifier.classify(segment.toRange(), lookup);
    ExtractionEligibility eligibility = eligibilityTable.lookup(segment);

    SegmentationConfig.Review review = segmentationConfig.getReview();
    ConfidenceBand band =
        ConfidenceBand.of(
            classification.confidence(), review.getHighConfidence(), review.getMinConfidence());
    boolean needsReview =
        classification.confidence() < review.getMinConfidence()
            || segment.mainType() == MainDocumentType.UNKNOWN;

    if (classification.tie()) {
      meterRegistry.counter("segmentation.classification.tie").increment();
    }
    meterRegistry
        .counter("segmentation.segments.created", "main_type", segment.mainType().name())
        .increment();

    log.debug(
        "Segment {} pages {}: {} / {} -> {} ({}) extract={} priority={}",
        segment.segmentId(),
        segment.toRange(),
        segment.mainType(),
        segment.subTypeLabel(),
        classification.documentType(),
        String.format("%.2f", classification.confidence()),
        eligibility.requiresExtraction(),
        eligibility.priority());

    return new RoutedSegment(
        segment,
        classification,
        eligibility.requiresExtraction(),
        eligibility.priority(),
        band,
        needsReview,
        firstIdentifier(segment, lookup, PageIdentifiers::documentId),
        firstIdentifier(segment, lookup, PageIdentifiers::documentTitle));
  }

  private static String firstIdentifier(
      Segment segment, PageRecordLookup lookup, Function<PageIdentifiers, String> field) {
    for (int page : segment.pages()) {
      String value =
          lookup
              .lookup(page)
              .map(PageAnalysis::identifiers)
              .map(field)
              .filter(v -> !v.isBlank())
              .orElse(null);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  private static SegmentationSummary summarize(
      int totalPages, int succeededPages, List<RoutedSegment> routed) {
    Map<MainDocumentType, Integer> counts = new EnumMap<>(MainDocumentType.class);
    double confidenceSum = 0.0;
    int needsReview = 0;
    for (RoutedSegment segment : routed) {
      counts.merge(segment.classification().documentType(), 1, Integer::sum);
      confidenceSum += segment.classification().confidence();
      if (segment.needsReview()) {
        needsReview++;
      }
    }
    double average = routed.isEmpty() ? 0.0 : confidenceSum / routed.size();
    return new SegmentationSummary(
        totalPages,
        succeededPages,
        totalPages - succeededPages,
        routed.size(),
        counts,
        average,
        needsReview);
  }
}
