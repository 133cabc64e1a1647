package com.flamingo.ai.docinsight.service.extraction.model;

import java.util.List;

/**
 * Layout extraction of a whole document.
 *
 * @param documentId identifier reported in results, usually the file name
 * @param pages pages in document order
 */
public record RawDocument(String documentId, List<PageRuns> pages) {

  public static RawDocument empty(String documentId) {
    return new RawDocument(documentId, List.of());
  }
}
