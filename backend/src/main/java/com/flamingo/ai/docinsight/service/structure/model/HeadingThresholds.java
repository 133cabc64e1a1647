package com.flamingo.ai.docinsight.service.structure.model;

/**
 * Per-document minimum font sizes for each heading level.
 *
 * @param h1 minimum H1 size
 * @param h2 minimum H2 size
 * @param h3 minimum H3 size
 * @param dominantSize dominant body size the thresholds were derived from
 */
public record HeadingThresholds(float h1, float h2, float h3, float dominantSize) {

  public HeadingLevel levelFor(float size) {
    if (size >= h1) {
      return HeadingLevel.H1;
    }
    if (size >= h2) {
      return HeadingLevel.H2;
    }
    if (size >= h3) {
      return HeadingLevel.H3;
    }
    return HeadingLevel.NONE;
  }
}
