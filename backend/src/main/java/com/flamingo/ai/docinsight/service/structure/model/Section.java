package com.flamingo.ai.docinsight.service.structure.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Contiguous body text owned by one heading, or the preamble before the first heading.
 *
 * @param index position of this section within its document (0-based)
 * @param heading owning heading, {@code null} for the preamble
 * @param title heading text, empty for the preamble
 * @param level heading rank (1 to 3), 0 for the preamble
 * @param body body lines in reading order
 * @param startPage page of the heading, or of the first body line for the preamble
 * @param endPage last page before the next heading of equal or higher rank
 * @param breadcrumb titles of the open ancestor headings followed by this title
 * @param type content type derived from title and body
 */
public record Section(
    int index,
    HeadingCandidate heading,
    String title,
    int level,
    List<Line> body,
    int startPage,
    int endPage,
    List<String> breadcrumb,
    SectionType type) {

  public boolean isPreamble() {
    return heading == null;
  }

  public String rawText() {
    return body.stream().map(Line::text).collect(Collectors.joining("\n"));
  }

  public int wordCount() {
    return body.stream().mapToInt(Line::wordCount).sum();
  }
}
