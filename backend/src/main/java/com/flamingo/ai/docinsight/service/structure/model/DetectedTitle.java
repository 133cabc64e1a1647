package com.flamingo.ai.docinsight.service.structure.model;

import java.util.List;

/**
 * Result of title detection.
 *
 * @param text cleaned title text, empty when no title was found
 * @param line the page-0 line chosen as title, or {@code null}
 * @param continuation lines directly below {@code line} that wrap the same title
 * @param score composite title score of {@code line}
 */
public record DetectedTitle(String text, Line line, List<Line> continuation, double score) {

  public DetectedTitle {
    continuation = continuation == null ? List.of() : List.copyOf(continuation);
  }

  public DetectedTitle(String text, Line line, double score) {
    this(text, line, List.of(), score);
  }

  public static DetectedTitle none() {
    return new DetectedTitle("", null, 0.0);
  }

  public boolean isPresent() {
    return line != null;
  }

  /** Whether {@code candidate} is a wrapped second or third line of the title. */
  public boolean isContinuation(Line candidate) {
    return continuation.stream().anyMatch(l -> l == candidate);
  }

  /** Font size of the title line, or {@code NaN} when there is none. */
  public float fontSize() {
    return line != null ? line.fontSize() : Float.NaN;
  }
}
