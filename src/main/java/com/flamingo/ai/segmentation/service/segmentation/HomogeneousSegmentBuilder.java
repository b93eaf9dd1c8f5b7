package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.SubType;
import com.flamingo.ai.segmentation.domain.model.AnnotatedPage;
import com.flamingo.ai.segmentation.domain.model.PageRange;
import com.flamingo.ai.segmentation.domain.model.Segment;
import com.flamingo.ai.segmentation.domain.model.SubtypeAssignment;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Groups consecutive pages sharing a (main type, sub-type) pair into segments, then folds weak
 * single-page segments into a same-family predecessor.
 *
 * <p>Running confidence is updated as {@code (previous + page) / 2} on every extension. This is an
 * order-dependent running average, not the mean over member pages.
 */
@Slf4j
@Component
public class HomogeneousSegmentBuilder {

  public static final double DEFAULT_MERGE_THRESHOLD = 0.6;

  /**
   * Builds homogeneous segments over annotated pages.
   *
   * @param pages pages in page order, starting at page 1 with no gaps
   * @return segments partitioning the pages, ids 1..K
   */
  public List<Segment> build(List<AnnotatedPage> pages) {
    List<Segment> segments = new ArrayList<>();
    if (pages.isEmpty()) {
      return segments;
    }

    OpenSegment current = null;
    for (AnnotatedPage page : pages) {
      if (current == null) {
        current = new OpenSegment(page);
      } else if (current.assignment.sameBucket(page.assignment())) {
        current.extend(page);
      } else {
        segments.add(current.close(segments.size() + 1));
        current = new OpenSegment(page);
      }
    }
    segments.add(current.close(segments.size() + 1));

    log.debug("Built {} homogeneous segment(s) over {} page(s)", segments.size(), pages.size());
    return segments;
  }

  /** Merges with {@link #DEFAULT_MERGE_THRESHOLD}. */
  public List<Segment> mergeSinglePageSegments(List<Segment> segments) {
    return mergeSinglePageSegments(segments, DEFAULT_MERGE_THRESHOLD);
  }

  /**
   * Single forward pass: a one-page segment below {@code minConfidence} that is not first is
   * appended to the previous <em>output</em> segment when both share a main type. The combined
   * label is {@code "<previous> + <merged>"}. Segments are renumbered 1..K afterwards.
   *
   * @param segments segments in page order
   * @param minConfidence singleton segments below this are merge candidates
   * @return the merged list
   */
  public List<Segment> mergeSinglePageSegments(List<Segment> segments, double minConfidence) {
    if (segments.size() <= 1) {
      return renumber(segments);
    }

    List<Segment> merged = new ArrayList<>();
    for (int i = 0; i < segments.size(); i++) {
      Segment current = segments.get(i);
      boolean weakSingleton = current.isSinglePage() && current.confidence() < minConfidence;

      if (weakSingleton && i > 0) {
        Segment previous = merged.get(merged.size() - 1);
        if (previous.mainType() == current.mainType()) {
          merged.set(merged.size() - 1, previous.absorb(current));
          log.debug(
              "Merged low-confidence page {} ({}) into segment {}",
              current.startPage(),
              current.subTypeLabel(),
              previous.toRange());
          continue;
        }
      }
      merged.add(current);
    }
    return renumber(merged);
  }

  private static List<Segment> renumber(List<Segment> segments) {
    List<Segment> result = new ArrayList<>(segments.size());
    for (int i = 0; i < segments.size(); i++) {
      result.add(segments.get(i).withSegmentId(i + 1));
    }
    return result;
  }

  /** Segment under construction. */
  private static final class OpenSegment {
    private final SubtypeAssignment assignment;
    private final int startPage;
    private int endPage;
    private double confidence;

    OpenSegment(AnnotatedPage first) {
      this.assignment = first.assignment();
      this.startPage = first.pageNumber();
      this.endPage = first.pageNumber();
      this.confidence = first.assignment().confidence();
    }

    void extend(AnnotatedPage page) {
      endPage = page.pageNumber();
      confidence = (confidence + page.assignment().confidence()) / 2;
    }

    Segment close(int segmentId) {
      MainDocumentType mainType = assignment.mainType();
      SubType subType = assignment.subType();
      return Segment.of(
          segmentId, new PageRange(startPage, endPage), mainType, subType, confidence);
    }
  }
}
