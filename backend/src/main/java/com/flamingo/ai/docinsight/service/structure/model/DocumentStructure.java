package com.flamingo.ai.docinsight.service.structure.model;

import java.util.List;

/**
 * Everything the structure extractor derives from one document.
 *
 * @param documentId document identifier
 * @param title detected title
 * @param classifiedLines every line with its level, in reading order
 * @param sections segmented sections in reading order
 * @param stats font-size statistics
 */
public record DocumentStructure(
    String documentId,
    DetectedTitle title,
    List<HeadingCandidate> classifiedLines,
    List<Section> sections,
    DocumentStats stats) {

  public static DocumentStructure empty(String documentId) {
    return new DocumentStructure(
        documentId, DetectedTitle.none(), List.of(), List.of(), DocumentStats.empty());
  }

  public List<HeadingCandidate> outline() {
    return classifiedLines.stream().filter(HeadingCandidate::isHeading).toList();
  }
}
