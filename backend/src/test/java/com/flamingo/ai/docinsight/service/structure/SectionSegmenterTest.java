package com.flamingo.ai.docinsight.service.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docinsight.service.structure.model.HeadingCandidate;
import com.flamingo.ai.docinsight.service.structure.model.HeadingLevel;
import com.flamingo.ai.docinsight.service.structure.model.Line;
import com.flamingo.ai.docinsight.service.structure.model.Section;
import com.flamingo.ai.docinsight.service.structure.model.SectionType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SectionSegmenter Tests")
class SectionSegmenterTest {

  private SectionSegmenter segmenter;

  @BeforeEach
  void setUp() {
    segmenter = new SectionSegmenter(new SectionTypeClassifier());
  }

  private static HeadingCandidate candidate(String text, HeadingLevel level, int page) {
    Line line = new Line(text, 10f, "Helvetica", false, false, page, 72f, 100f, List.of());
    return new HeadingCandidate(line, level, level.isHeading() ? 0.8 : 0.0);
  }

  private static HeadingCandidate body(String text, int page) {
    return candidate(text, HeadingLevel.NONE, page);
  }

  @Test
  @DisplayName("should assign every body line to exactly one section")
  void shouldOwnEveryBodyLineOnce() {
    List<HeadingCandidate> lines =
        List.of(
            candidate("Report", HeadingLevel.TITLE, 0),
            body("Opening remarks before any heading.", 0),
            candidate("Introduction", HeadingLevel.H1, 0),
            body("Intro line one.", 0),
            body("Intro line two.", 1),
            candidate("Scope", HeadingLevel.H2, 1),
            body("Scope line.", 1),
            candidate("Methods", HeadingLevel.H1, 2),
            body("Methods line.", 2));

    List<Section> sections = segmenter.segment(lines);

    assertThat(sections).extracting(Section::title)
        .containsExactly("", "Introduction", "Scope", "Methods");
    int bodyLines = sections.stream().mapToInt(s -> s.body().size()).sum();
    assertThat(bodyLines).isEqualTo(5);
    assertThat(sections).extracting(Section::index).containsExactly(0, 1, 2, 3);
    assertThat(sections.get(0).isPreamble()).isTrue();
    assertThat(sections.get(0).level()).isZero();
  }

  @Test
  @DisplayName("should leave the title line out of every section")
  void shouldSkipTitleLine() {
    List<Section> sections =
        segmenter.segment(
            List.of(
                candidate("Report", HeadingLevel.TITLE, 0),
                candidate("Summary", HeadingLevel.H1, 0),
                body("Summary body.", 0)));

    assertThat(sections).hasSize(1);
    assertThat(sections.get(0).rawText()).doesNotContain("Report");
  }

  @Test
  @DisplayName("should not emit a preamble without body lines")
  void shouldOmitEmptyPreamble() {
    List<Section> sections =
        segmenter.segment(
            List.of(candidate("Summary", HeadingLevel.H1, 0), body("Summary body.", 0)));

    assertThat(sections).noneMatch(Section::isPreamble);
  }

  @Test
  @DisplayName("should extend a parent's page span over its subsections")
  void shouldSpanSubsections() {
    List<Section> sections =
        segmenter.segment(
            List.of(
                candidate("Chapter", HeadingLevel.H1, 0),
                body("Chapter body.", 0),
                candidate("Part A", HeadingLevel.H2, 1),
                body("Part A body.", 2),
                candidate("Detail", HeadingLevel.H3, 3),
                body("Detail body.", 3),
                candidate("Part B", HeadingLevel.H2, 4),
                candidate("Next Chapter", HeadingLevel.H1, 5)));

    assertThat(sections.get(0).startPage()).isZero();
    assertThat(sections.get(0).endPage()).isEqualTo(4);
    // Part A closes at Part B
    assertThat(sections.get(1).startPage()).isEqualTo(1);
    assertThat(sections.get(1).endPage()).isEqualTo(3);
    assertThat(sections.get(2).endPage()).isEqualTo(3);
    assertThat(sections.get(4).startPage()).isEqualTo(5);
  }

  @Test
  @DisplayName("should build breadcrumbs from open ancestors")
  void shouldBuildBreadcrumbs() {
    List<Section> sections =
        segmenter.segment(
            List.of(
                candidate("Chapter", HeadingLevel.H1, 0),
                candidate("Part A", HeadingLevel.H2, 0),
                candidate("Detail", HeadingLevel.H3, 0),
                candidate("Part B", HeadingLevel.H2, 0)));

    assertThat(sections.get(2).breadcrumb()).containsExactly("Chapter", "Part A", "Detail");
    assertThat(sections.get(3).breadcrumb()).containsExactly("Chapter", "Part B");
  }

  @Test
  @DisplayName("should classify the section type at segmentation time")
  void shouldClassifySectionType() {
    List<Section> sections =
        segmenter.segment(
            List.of(candidate("Methodology", HeadingLevel.H1, 0), body("We sampled data.", 0)));

    assertThat(sections.get(0).type()).isEqualTo(SectionType.METHODOLOGY);
  }

  @Test
  @DisplayName("should return no sections for no lines")
  void shouldHandleEmptyInput() {
    assertThat(segmenter.segment(List.of())).isEmpty();
  }
}
