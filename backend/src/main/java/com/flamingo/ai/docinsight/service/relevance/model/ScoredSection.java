package com.flamingo.ai.docinsight.service.relevance.model;

import com.flamingo.ai.docinsight.service.structure.model.Section;

/**
 * A section with its composite relevance score.
 *
 * @param documentId owning document
 * @param documentOrder position of the document in the input collection
 * @param documentTitle detected title of the owning document, empty if none
 * @param section the scored section
 * @param score composite score in [0, 1]
 * @param breakdown the individual factors
 */
public record ScoredSection(
    String documentId,
    int documentOrder,
    String documentTitle,
    Section section,
    double score,
    ScoreBreakdown breakdown) {

  /** Heading text, or the document title for the preamble. */
  public String displayTitle() {
    if (section.isPreamble()) {
      return documentTitle != null ? documentTitle : "";
    }
    return section.title();
  }

  public int page() {
    return section.startPage();
  }
}
