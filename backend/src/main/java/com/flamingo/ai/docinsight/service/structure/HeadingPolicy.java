package com.flamingo.ai.docinsight.service.structure;

import com.flamingo.ai.docinsight.service.structure.model.DocumentStats;
import com.flamingo.ai.docinsight.service.structure.model.HeadingThresholds;
import com.flamingo.ai.docinsight.service.structure.model.Line;
import com.flamingo.ai.docinsight.service.structure.model.PatternMatch;

/**
 * Classification rules used by {@link HeadingClassifier}.
 *
 * <p>Implementations must be pure functions of their arguments: thresholds are recomputed for
 * every document and never cached across documents.
 */
public interface HeadingPolicy {

  /**
   * Derives the heading size thresholds of one document.
   *
   * @param stats the document's font-size statistics
   * @param titleSize font size of the detected title, {@code NaN} when there is none
   * @return the thresholds
   */
  HeadingThresholds thresholds(DocumentStats stats, float titleSize);

  /**
   * Applies the textual pattern rules (numbering, chapter markers, capitalisation, style).
   *
   * @param line the line to inspect
   * @return the match, {@link PatternMatch#none()} when no rule applies
   */
  PatternMatch matchPattern(Line line);

  /**
   * Whether the line may become a heading through the size rule alone.
   *
   * @param line the line to inspect
   * @return {@code true} if its shape allows a heading
   */
  boolean eligibleForSizeRule(Line line);
}
