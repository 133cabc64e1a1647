package com.flamingo.ai.docinsight.service.structure;

import com.flamingo.ai.docinsight.service.structure.model.HeadingCandidate;
import com.flamingo.ai.docinsight.service.structure.model.HeadingLevel;
import com.flamingo.ai.docinsight.service.structure.model.Line;
import com.flamingo.ai.docinsight.service.structure.model.Section;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Cuts the classified line stream of a document into sections.
 *
 * <p>Every heading opens a section and body lines belong to the most recent one, so sections never
 * overlap and each body line is owned exactly once. Lines before the first heading form a preamble
 * section. A section's page span runs until the next heading of equal or higher rank, covering its
 * subsections. The title line belongs to no section.
 */
@Component
@RequiredArgsConstructor
public class SectionSegmenter {

  private final SectionTypeClassifier sectionTypeClassifier;

  public List<Section> segment(List<HeadingCandidate> classifiedLines) {
    List<SectionBuilder> builders = new ArrayList<>();
    // Open headings, innermost first
    Deque<SectionBuilder> open = new ArrayDeque<>();
    SectionBuilder preamble = new SectionBuilder(null, List.of());
    SectionBuilder current = preamble;

    for (HeadingCandidate candidate : classifiedLines) {
      HeadingLevel level = candidate.level();
      if (level == HeadingLevel.TITLE) {
        continue;
      }
      int page = candidate.line().pageIndex();

      if (level.isHeading()) {
        while (!open.isEmpty() && open.peek().rank() >= level.rank()) {
          open.pop();
        }
        List<String> ancestors = new ArrayList<>();
        Iterator<SectionBuilder> outermostFirst = open.descendingIterator();
        while (outermostFirst.hasNext()) {
          ancestors.add(outermostFirst.next().title());
        }
        current = new SectionBuilder(candidate, ancestors);
        builders.add(current);
        open.push(current);
      } else {
        current.body.add(candidate.line());
      }

      current.extendTo(page);
      for (SectionBuilder ancestor : open) {
        ancestor.extendTo(page);
      }
    }

    List<Section> sections = new ArrayList<>();
    if (!preamble.body.isEmpty()) {
      sections.add(preamble.build(sections.size()));
    }
    for (SectionBuilder builder : builders) {
      sections.add(builder.build(sections.size()));
    }
    return List.copyOf(sections);
  }

  private final class SectionBuilder {

    private final HeadingCandidate heading;
    private final List<String> ancestors;
    private final List<Line> body = new ArrayList<>();
    private int startPage = -1;
    private int endPage = -1;

    SectionBuilder(HeadingCandidate heading, List<String> ancestors) {
      this.heading = heading;
      this.ancestors = ancestors;
    }

    int rank() {
      return heading == null ? 0 : heading.level().rank();
    }

    String title() {
      return heading == null ? "" : heading.line().text();
    }

    void extendTo(int page) {
      if (startPage < 0) {
        startPage = page;
      }
      endPage = Math.max(endPage, page);
    }

    Section build(int index) {
      List<String> breadcrumb = new ArrayList<>(ancestors);
      if (heading != null) {
        breadcrumb.add(title());
      }
      String bodyText = body.stream().map(Line::text).collect(Collectors.joining("\n"));
      return new Section(
          index,
          heading,
          title(),
          rank(),
          List.copyOf(body),
          startPage,
          endPage,
          List.copyOf(breadcrumb),
          sectionTypeClassifier.classify(title(), bodyText));
    }
  }
}
