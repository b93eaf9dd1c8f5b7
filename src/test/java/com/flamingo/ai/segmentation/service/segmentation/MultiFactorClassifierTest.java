package com.flamingo.ai.segmentation.service.segmentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.segmentation.domain.enums.MainDocumentType;
import com.flamingo.ai.segmentation.domain.enums.PageKind;
import com.flamingo.ai.segmentation.domain.model.ClassificationResult;
import com.flamingo.ai.segmentation.domain.model.PageRange;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MultiFactorClassifier Tests")
class MultiFactorClassifierTest {

  private MultiFactorClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier = new MultiFactorClassifier();
  }

  private ClassificationResult classify(PageRecordLookup lookup) {
    return classifier.classify(new PageRange(1, lookup.pageCount()), lookup);
  }

  @Nested
  @DisplayName("Clear decisions")
  class ClearDecisions {

    @Test
    @DisplayName("Should classify hinted purchase order pages as WORK_ORDER")
    void shouldClassifyWorkOrder() {
      List<String> snippets = List.of("purchase order", "gstin");
      PageRecordLookup lookup =
          PageRecordLookup.of(
              List.of(
                  TestPages.page(1, Set.of(MainDocumentType.WORK_ORDER), snippets),
                  TestPages.page(2, Set.of(MainDocumentType.WORK_ORDER), snippets),
                  TestPages.page(3, Set.of(MainDocumentType.WORK_ORDER), snippets)));

      ClassificationResult result = classify(lookup);

      assertThat(result.documentType()).isEqualTo(MainDocumentType.WORK_ORDER);
      assertThat(result.confidence()).isGreaterThanOrEqualTo(0.7);
      assertThat(result.scoreFor(MainDocumentType.WORK_ORDER)).isCloseTo(70.0, within(1e-9));
      assertThat(result.scoreFor(MainDocumentType.TURNOVER)).isZero();
      assertThat(result.tie()).isFalse();
      assertThat(result.validPages()).isEqualTo(3);
      assertThat(result.reasoning())
          .isEqualTo("found 3 hint(s) for WORK_ORDER; 3 keyword matches");
    }

    @Test
    @DisplayName("Should add the financial bonus and table flag for a balance sheet")
    void shouldClassifyBalanceSheet_asTurnover() {
      PageRecordLookup lookup =
          PageRecordLookup.of(
              List.of(
                  TestPages.page(
                      1,
                      TestPages.analysis()
                          .typeHints(Set.of(MainDocumentType.TURNOVER))
                          .textSnippets(List.of("Balance Sheet as at 31 March 2024"))
                          .structureFlags(TestPages.flags(true, false))
                          .build())));

      ClassificationResult result = classify(lookup);

      assertThat(result.documentType()).isEqualTo(MainDocumentType.TURNOVER);
      assertThat(result.confidence()).isCloseTo(0.95, within(1e-9));
      assertThat(result.scoreFor(MainDocumentType.WORK_ORDER)).isCloseTo(5.0, within(1e-9));
      assertThat(result.reasoning()).isEqualTo("found 1 hint(s) for TURNOVER; 1 keyword matches");
    }

    @Test
    @DisplayName("Should mention the certificate page in the reasoning")
    void shouldMentionCertificatePage() {
      PageRecordLookup lookup =
          PageRecordLookup.of(
              List.of(
                  TestPages.page(
                      1,
                      TestPages.analysis()
                          .pageKind(PageKind.CERTIFICATE)
                          .structureFlags(TestPages.flags(false, true))
                          .build())));

      ClassificationResult result = classify(lookup);

      assertThat(result.documentType()).isEqualTo(MainDocumentType.WORK_ORDER);
      assertThat(result.confidence()).isCloseTo(0.25, within(1e-9));
      assertThat(result.reasoning()).isEqualTo("contains certificate page");
    }

    @Test
    @DisplayName("Should fall back to a structural reasoning when no evidence is named")
    void shouldFallBackToStructuralReasoning() {
      PageRecordLookup lookup =
          PageRecordLookup.of(
              List.of(
                  TestPages.page(
                      1,
                      TestPages.analysis()
                          .structureFlags(TestPages.flags(true, true))
                          .build())));

      ClassificationResult result = classify(lookup);

      assertThat(result.documentType()).isEqualTo(MainDocumentType.WORK_ORDER);
      assertThat(result.confidence()).isCloseTo(0.10, within(1e-9));
      assertThat(result.reasoning())
          .isEqualTo("pattern match for WORK_ORDER document structure");
    }

    @Test
    @DisplayName("Should leave failed pages out of the hint denominator")
    void shouldIgnoreFailedPages_inDenominator() {
      PageRecordLookup lookup =
          PageRecordLookup.of(
              List.of(
                  TestPages.page(1, Set.of(MainDocumentType.WORK_ORDER), List.of()),
                  TestPages.failed(2)));

      ClassificationResult result = classify(lookup);

      assertThat(result.scoreFor(MainDocumentType.WORK_ORDER)).isCloseTo(40.0, within(1e-9));
      assertThat(result.validPages()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Ties and missing data")
  class TiesAndMissingData {

    @Test
    @DisplayName("Should default an exact tie to WORK_ORDER at 0.5")
    void shouldDefaultExactTie_toWorkOrder() {
      PageRecordLookup lookup =
          PageRecordLookup.of(
              List.of(
                  TestPages.page(
                      1,
                      Set.of(MainDocumentType.WORK_ORDER, MainDocumentType.TURNOVER),
                      List.of("invoice", "revenue"))));

      ClassificationResult result = classify(lookup);

      assertThat(result.documentType()).isEqualTo(MainDocumentType.WORK_ORDER);
      assertThat(result.confidence()).isEqualTo(0.5);
      assertThat(result.tie()).isTrue();
      assertThat(result.reasoning()).contains("tie");
    }

    @Test
    @DisplayName("Should break a score tie towards the type with more hints")
    void shouldBreakScoreTie_byHintCount() {
      // TURNOVER: 40 * 1/2 from hints; WORK_ORDER: 20 from the certificate page
      PageRecordLookup lookup =
          PageRecordLookup.of(
              List.of(
                  TestPages.page(1, Set.of(MainDocumentType.TURNOVER), List.of()),
                  TestPages.page(2, TestPages.analysis().pageKind(PageKind.CERTIFICATE).build())));

      ClassificationResult result = classify(lookup);

      assertThat(result.documentType()).isEqualTo(MainDocumentType.TURNOVER);
      assertThat(result.confidence()).isEqualTo(0.5);
      assertThat(result.tie()).isTrue();
    }

    @Test
    @DisplayName("Should return UNKNOWN when every page failed")
    void shouldReturnUnknown_whenAllPagesFailed() {
      PageRecordLookup lookup =
          PageRecordLookup.of(List.of(TestPages.failed(1), TestPages.failed(2)));

      ClassificationResult result = classify(lookup);

      assertThat(result.documentType()).isEqualTo(MainDocumentType.UNKNOWN);
      assertThat(result.confidence()).isZero();
      assertThat(result.reasoning()).contains("no valid");
      assertThat(result.scoreFor(MainDocumentType.WORK_ORDER)).isZero();
      assertThat(result.scoreFor(MainDocumentType.TURNOVER)).isZero();
    }
  }

  @Test
  @DisplayName("Should keep confidence and scores within bounds for every evidence mix")
  void shouldKeepScoresBounded() {
    PageRecordLookup lookup =
        PageRecordLookup.of(
            List.of(
                TestPages.page(
                    1,
                    TestPages.analysis()
                        .pageKind(PageKind.CERTIFICATE)
                        .typeHints(Set.of(MainDocumentType.WORK_ORDER))
                        .textSnippets(List.of("Work Order", "Purchase Order", "GSTIN"))
                        .structureFlags(TestPages.flags(true, true))
                        .build())));

    ClassificationResult result = classify(lookup);

    assertThat(result.confidence()).isBetween(0.0, 1.0);
    assertThat(result.scores().values()).allSatisfy(s -> assertThat(s).isBetween(0.0, 100.0));
    assertThat(result.confidence()).isCloseTo(1.0, within(1e-9));
  }
}
