package com.flamingo.ai.docinsight.service.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.service.structure.model.DetectedTitle;
import com.flamingo.ai.docinsight.service.structure.model.NormalizedDocument;
import com.flamingo.ai.docinsight.support.TestDocuments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TitleDetector Tests")
class TitleDetectorTest {

  private LayoutNormalizer normalizer;
  private TitleDetector detector;

  @BeforeEach
  void setUp() {
    DocInsightConfig config = new DocInsightConfig();
    normalizer = new LayoutNormalizer(config);
    detector = new TitleDetector(config);
  }

  private DetectedTitle detect(TestDocuments builder) {
    NormalizedDocument normalized = normalizer.normalize(builder.build());
    return detector.detect(normalized);
  }

  @Test
  @DisplayName("should detect a large bold line at the top of page 0")
  void shouldDetectLargeBoldTitle() {
    DetectedTitle title =
        detect(
            TestDocuments.document("report.pdf")
                .page()
                .heading("Market Report 2024", 24f)
                .paragraph(5));

    assertThat(title.isPresent()).isTrue();
    assertThat(title.text()).isEqualTo("Market Report 2024");
    assertThat(title.score()).isBetween(0.5, 1.0);
    assertThat(title.line().pageIndex()).isZero();
  }

  @Test
  @DisplayName("should not take a numbered heading as the title")
  void shouldSkipNumberedHeading() {
    DetectedTitle title =
        detect(
            TestDocuments.document("paper.pdf")
                .page()
                .heading("1. Introduction", 18f)
                .paragraph(3));

    assertThat(title.isPresent()).isFalse();
  }

  @Test
  @DisplayName("should return no title when nothing stands out from the body")
  void shouldReturnNoneForPlainText() {
    DetectedTitle title =
        detect(TestDocuments.document("plain.pdf").page().paragraph(6));

    assertThat(title.isPresent()).isFalse();
    assertThat(title.text()).isEmpty();
    assertThat(title.fontSize()).isNaN();
  }

  @Test
  @DisplayName("should only consider page 0")
  void shouldIgnoreLaterPages() {
    DetectedTitle title =
        detect(
            TestDocuments.document("doc.pdf")
                .page()
                .paragraph(3)
                .page()
                .heading("Big Statement On Page Two", 28f)
                .paragraph(3));

    assertThat(title.isPresent()).isFalse();
  }

  @Test
  @DisplayName("should cap long titles at a word boundary")
  void shouldCapLongTitles() {
    String longTitle = "Comprehensive Evaluation ".repeat(12).trim();

    DetectedTitle title =
        detect(TestDocuments.document("long.pdf").page().heading(longTitle, 24f).paragraph(3));

    assertThat(title.isPresent()).isTrue();
    assertThat(title.text()).hasSizeLessThanOrEqualTo(100);
    assertThat(title.text()).startsWith("Comprehensive Evaluation");
    assertThat(title.text()).doesNotEndWith(" ");
    assertThat(longTitle).startsWith(title.text());
  }

  @Test
  @DisplayName("should join a title wrapped over two lines of the same style")
  void shouldJoinWrappedTitle() {
    DetectedTitle title =
        detect(
            TestDocuments.document("report.pdf")
                .page()
                .heading("Annual Market Report for", 24f)
                .heading("Northern Region Retailers", 24f)
                .heading("Prepared for the Board", 14f)
                .paragraph(4));

    assertThat(title.text()).isEqualTo("Annual Market Report for Northern Region Retailers");
    assertThat(title.line().text()).isEqualTo("Annual Market Report for");
    assertThat(title.continuation())
        .extracting(l -> l.text())
        .containsExactly("Northern Region Retailers");
  }

  @Test
  @DisplayName("should not join a following line in a different size")
  void shouldNotJoinSubtitle() {
    DetectedTitle title =
        detect(
            TestDocuments.document("report.pdf")
                .page()
                .heading("Market Report 2024", 24f)
                .heading("Executive Summary", 16f)
                .paragraph(4));

    assertThat(title.text()).isEqualTo("Market Report 2024");
    assertThat(title.continuation()).isEmpty();
  }

  @Nested
  @DisplayName("content score")
  class ContentScore {

    @Test
    @DisplayName("should prefer title case over all caps")
    void shouldPreferTitleCase() {
      assertThat(detector.contentScore("Annual Financial Review"))
          .isGreaterThan(detector.contentScore("ANNUAL FINANCIAL REVIEW"));
    }

    @Test
    @DisplayName("should penalise sentence punctuation and very short text")
    void shouldPenaliseBodyLikeText() {
      assertThat(detector.contentScore("Annual Financial Review"))
          .isGreaterThan(detector.contentScore("Annual financial review,"));
      assertThat(detector.contentScore("Review"))
          .isLessThan(detector.contentScore("Annual Financial Review"));
    }

    @Test
    @DisplayName("should stay within [0, 1]")
    void shouldStayInBounds() {
      assertThat(detector.contentScore("x")).isBetween(0.0, 1.0);
      assertThat(detector.contentScore("A Good Title For Tests")).isBetween(0.0, 1.0);
    }
  }
}
