package com.flamingo.ai.docinsight.service.structure.model;

/**
 * A line with its assigned structural level.
 *
 * @param line the classified line
 * @param level TITLE, H1, H2, H3 or NONE (body text)
 * @param confidence detection confidence in [0, 1]; never changes {@code level}
 */
public record HeadingCandidate(Line line, HeadingLevel level, double confidence) {

  public HeadingCandidate withLevel(HeadingLevel newLevel) {
    return new HeadingCandidate(line, newLevel, confidence);
  }

  public boolean isHeading() {
    return level.isHeading();
  }
}
