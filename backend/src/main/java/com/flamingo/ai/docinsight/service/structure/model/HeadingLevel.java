package com.flamingo.ai.docinsight.service.structure.model;

/** Structural role assigned to a line. */
public enum HeadingLevel {
  TITLE(0),
  H1(1),
  H2(2),
  H3(3),
  NONE(Integer.MAX_VALUE);

  private final int rank;

  HeadingLevel(int rank) {
    this.rank = rank;
  }

  /** Nesting depth: 1 for H1, 2 for H2, 3 for H3. */
  public int rank() {
    return rank;
  }

  public boolean isHeading() {
    return this == H1 || this == H2 || this == H3;
  }

  /** Maps a numbering depth ({@code 1} for "2.", {@code 2} for "2.1") to a level. */
  public static HeadingLevel forDepth(int depth) {
    if (depth <= 1) {
      return H1;
    }
    return depth == 2 ? H2 : H3;
  }
}
