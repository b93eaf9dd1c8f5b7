package com.flamingo.ai.segmentation.service.segmentation;

import static com.flamingo.ai.segmentation.service.segmentation.TestPages.annotated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.SubType;
import com.flamingo.ai.segmentation.domain.model.AnnotatedPage;
import com.flamingo.ai.segmentation.domain.model.PageRange;
import com.flamingo.ai.segmentation.domain.model.Segment;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HomogeneousSegmentBuilder Tests")
class HomogeneousSegmentBuilderTest {

  private static final MainDocumentType T = MainDocumentType.TURNOVER;
  private static final MainDocumentType WO = MainDocumentType.WORK_ORDER;

  private HomogeneousSegmentBuilder builder;

  @BeforeEach
  void setUp() {
    builder = new HomogeneousSegmentBuilder();
  }

  @Nested
  @DisplayName("Building")
  class Building {

    @Test
    @DisplayName("Should group consecutive pages with the same sub-type")
    void shouldGroupConsecutivePages() {
      List<Segment> segments =
          builder.build(
              List.of(
                  annotated(1, T, SubType.PL_STATEMENT, 0.8),
                  annotated(2, T, SubType.PL_STATEMENT, 0.4),
                  annotated(3, WO, SubType.PURCHASE_ORDER, 0.9)));

      assertThat(segments).hasSize(2);
      assertThat(segments.get(0).pages()).containsExactly(1, 2);
      assertThat(segments.get(0).subTypeLabel()).isEqualTo("P&L Statement");
      assertThat(segments.get(0).confidence()).isCloseTo(0.6, within(1e-9));
      assertThat(segments.get(1).pages()).containsExactly(3);
      assertThat(segments.get(1).mainType()).isEqualTo(WO);
      assertThat(segments).extracting(Segment::segmentId).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should use the running pairwise average for confidence")
    void shouldUseRunningAverage() {
      List<Segment> segments =
          builder.build(
              List.of(
                  annotated(1, T, SubType.PL_STATEMENT, 1.0),
                  annotated(2, T, SubType.PL_STATEMENT, 0.4),
                  annotated(3, T, SubType.PL_STATEMENT, 0.4)));

      // ((1.0 + 0.4) / 2 + 0.4) / 2, not the plain mean of 0.6
      assertThat(segments.get(0).confidence()).isCloseTo(0.55, within(1e-9));
    }

    @Test
    @DisplayName("Should split on the same sub-type under a different main type")
    void shouldSplitOnMainTypeChange() {
      List<Segment> segments =
          builder.build(
              List.of(
                  annotated(1, T, SubType.CA_CERTIFICATE, 0.7),
                  annotated(2, WO, SubType.CA_CERTIFICATE, 0.7)));

      assertThat(segments).hasSize(2);
    }

    @Test
    @DisplayName("Should return no segments for no pages")
    void shouldReturnEmpty_forNoPages() {
      assertThat(builder.build(List.of())).isEmpty();
    }
  }

  @Nested
  @DisplayName("Merging single-page segments")
  class Merging {

    @Test
    @DisplayName("Should fold a weak singleton into a same-family predecessor")
    void shouldMergeWeakSingleton() {
      List<Segment> segments =
          builder.build(
              List.of(
                  annotated(1, T, SubType.PL_STATEMENT, 0.8),
                  annotated(2, T, SubType.PL_STATEMENT, 0.8),
                  annotated(3, T, SubType.BALANCE_SHEET, 0.4),
                  annotated(4, WO, SubType.PURCHASE_ORDER, 0.4)));

      List<Segment> merged = builder.mergeSinglePageSegments(segments);

      assertThat(merged).hasSize(2);
      Segment first = merged.get(0);
      assertThat(first.pages()).containsExactly(1, 2, 3);
      assertThat(first.subTypeLabel()).isEqualTo("P&L Statement + Balance Sheet");
      assertThat(first.subTypes()).containsExactly(SubType.PL_STATEMENT, SubType.BALANCE_SHEET);
      assertThat(first.confidence()).isCloseTo(0.8, within(1e-9));
      assertThat(first.mainType()).isEqualTo(T);
      assertThat(merged.get(1).pages()).containsExactly(4);
      assertThat(merged).extracting(Segment::segmentId).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should not merge the merged segment into what follows")
    void shouldNotReMergeMergedSegment() {
      List<Segment> segments =
          builder.build(
              List.of(
                  annotated(1, T, SubType.PL_STATEMENT, 0.8),
                  annotated(2, T, SubType.BALANCE_SHEET, 0.4),
                  annotated(3, T, SubType.INCOME_TAX, 0.9),
                  annotated(4, T, SubType.INCOME_TAX, 0.9)));

      List<Segment> merged = builder.mergeSinglePageSegments(segments);

      assertThat(merged).extracting(Segment::toRange)
          .containsExactly(new PageRange(1, 2), new PageRange(3, 4));
      assertThat(merged.get(0).subTypeLabel()).isEqualTo("P&L Statement + Balance Sheet");
      assertThat(merged.get(1).subTypeLabel()).isEqualTo("Income Tax Related");
    }

    @Test
    @DisplayName("Should keep a weak first segment")
    void shouldKeepWeakFirstSegment() {
      List<Segment> segments =
          builder.build(
              List.of(
                  annotated(1, T, SubType.BALANCE_SHEET, 0.3),
                  annotated(2, T, SubType.PL_STATEMENT, 0.9)));

      assertThat(builder.mergeSinglePageSegments(segments)).hasSize(2);
    }

    @Test
    @DisplayName("Should keep singletons at or above the threshold")
    void shouldKeepConfidentSingleton() {
      List<Segment> segments =
          builder.build(
              List.of(
                  annotated(1, T, SubType.PL_STATEMENT, 0.9),
                  annotated(2, T, SubType.BALANCE_SHEET, 0.6)));

      assertThat(builder.mergeSinglePageSegments(segments)).hasSize(2);
    }

    @Test
    @DisplayName("Should honor a custom threshold")
    void shouldHonorCustomThreshold() {
      List<Segment> segments =
          builder.build(
              List.of(
                  annotated(1, T, SubType.PL_STATEMENT, 0.9),
                  annotated(2, T, SubType.BALANCE_SHEET, 0.4)));

      assertThat(builder.mergeSinglePageSegments(segments, 0.3)).hasSize(2);
      assertThat(builder.mergeSinglePageSegments(segments, 0.5)).hasSize(1);
    }

    @Test
    @DisplayName("Should not merge across main types")
    void shouldNotMergeAcrossMainTypes() {
      List<Segment> segments =
          builder.build(
              List.of(
                  annotated(1, WO, SubType.PURCHASE_ORDER, 0.9),
                  annotated(2, MainDocumentType.UNKNOWN, SubType.UNKNOWN, 0.0)));

      assertThat(builder.mergeSinglePageSegments(segments)).hasSize(2);
    }
  }

  @Test
  @DisplayName("Should partition the pages before and after merging")
  void shouldPartitionPages() {
    Random random = new Random(7);
    SubType[] turnoverTypes = {SubType.PL_STATEMENT, SubType.BALANCE_SHEET, SubType.INCOME_TAX};
    for (int run = 0; run < 50; run++) {
      int pageCount = 1 + random.nextInt(15);
      List<AnnotatedPage> pages = new ArrayList<>();
      for (int page = 1; page <= pageCount; page++) {
        pages.add(
            annotated(
                page, T, turnoverTypes[random.nextInt(turnoverTypes.length)], random.nextDouble()));
      }
      List<Integer> expected = IntStream.rangeClosed(1, pageCount).boxed().toList();

      List<Segment> built = builder.build(pages);
      List<Segment> merged = builder.mergeSinglePageSegments(built);

      assertThat(built.stream().flatMap(s -> s.pages().stream()).toList())
          .containsExactlyElementsOf(expected);
      assertThat(merged.stream().flatMap(s -> s.pages().stream()).toList())
          .containsExactlyElementsOf(expected);
      assertThat(merged)
          .extracting(Segment::segmentId)
          .containsExactlyElementsOf(IntStream.rangeClosed(1, merged.size()).boxed().toList());
    }
  }
}
