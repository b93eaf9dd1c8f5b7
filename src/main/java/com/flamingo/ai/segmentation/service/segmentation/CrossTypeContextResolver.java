package com.flamingo.ai.segmentation.service.segmentation;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.model.AnnotatedPage;
import com.flamingo.ai.segmentation.domain.model.PageRange;
import com.flamingo.ai.segmentation.domain.model.SubtypeAssignment;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides the main type of a sub-type shared by both families (CA Certificate) from the pages
 * around it.
 */
@Slf4j
@Component
public class CrossTypeContextResolver {

  /**
   * Majority vote over neighbor main types. UNKNOWN neighbors do not vote; an exact tie (including
   * no votes) goes to TURNOVER.
   */
  public MainDocumentType resolve(Collection<MainDocumentType> neighborTypes) {
    int turnover = 0;
    int workOrder = 0;
    for (MainDocumentType type : neighborTypes) {
      if (type == MainDocumentType.TURNOVER) {
        turnover++;
      } else if (type == MainDocumentType.WORK_ORDER) {
        workOrder++;
      }
    }
    if (workOrder > turnover) {
      return MainDocumentType.WORK_ORDER;
    }
    return MainDocumentType.TURNOVER;
  }

  /**
   * Re-assigns every cross-type page using the other pages of its boundary range whose sub-type is
   * single-family and whose main type is known. Pages with no such neighbor keep the detector's
   * main type. Votes are taken from the detector's assignments, never from already resolved pages.
   *
   * @param pages annotated pages in page order
   * @param boundaries ranges from the boundary detector, covering every page
   * @return pages with cross-type assignments resolved
   */
  public List<AnnotatedPage> resolveAll(List<AnnotatedPage> pages, List<PageRange> boundaries) {
    List<AnnotatedPage> result = new ArrayList<>(pages.size());
    for (AnnotatedPage page : pages) {
      SubtypeAssignment assignment = page.assignment();
      if (!assignment.subType().isCrossType()) {
        result.add(page);
        continue;
      }

      PageRange boundary = boundaryOf(page.pageNumber(), boundaries);
      List<MainDocumentType> neighborTypes = new ArrayList<>();
      for (AnnotatedPage other : pages) {
        if (other.pageNumber() != page.pageNumber()
            && boundary.contains(other.pageNumber())
            && isVotingNeighbor(other.assignment())) {
          neighborTypes.add(other.assignment().mainType());
        }
      }

      if (neighborTypes.isEmpty()) {
        result.add(page);
        continue;
      }

      MainDocumentType resolved = resolve(neighborTypes);
      if (resolved != assignment.mainType()) {
        log.debug(
            "Page {} {} re-assigned {} -> {} from {} neighbor(s)",
            page.pageNumber(),
            assignment.subType().getLabel(),
            assignment.mainType(),
            resolved,
            neighborTypes.size());
      }
      result.add(page.withAssignment(assignment.withContextMainType(resolved)));
    }
    return result;
  }

  private static boolean isVotingNeighbor(SubtypeAssignment assignment) {
    return assignment.mainType() != MainDocumentType.UNKNOWN
        && !assignment.subType().isCrossType();
  }

  private static PageRange boundaryOf(int pageNumber, List<PageRange> boundaries) {
    for (PageRange range : boundaries) {
      if (range.contains(pageNumber)) {
        return range;
      }
    }
    return new PageRange(pageNumber, pageNumber);
  }
}
