package com.flamingo.ai.docinsight.service.structure.model;

import java.util.List;

/**
 * Lines of a document in reading order plus their statistics.
 *
 * @param documentId document identifier
 * @param lines lines ordered by page, then top to bottom
 * @param stats font-size statistics over {@code lines}
 */
public record NormalizedDocument(String documentId, List<Line> lines, DocumentStats stats) {

  public static NormalizedDocument empty(String documentId) {
    return new NormalizedDocument(documentId, List.of(), DocumentStats.empty());
  }
}
