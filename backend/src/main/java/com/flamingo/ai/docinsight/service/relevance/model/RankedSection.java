package com.flamingo.ai.docinsight.service.relevance.model;

/**
 * A selected section with its dense 1-based importance rank and refined excerpt.
 *
 * @param rank importance rank, 1 is most important
 * @param scored the underlying scored section
 * @param refinedText cleaned, length-capped excerpt of the section body
 */
public record RankedSection(int rank, ScoredSection scored, String refinedText) {

  public RankedSection withRefinedText(String text) {
    return new RankedSection(rank, scored, text);
  }
}
