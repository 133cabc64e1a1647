package com.flamingo.ai.docinsight.service.structure;

import com.flamingo.ai.docinsight.service.extraction.model.RawDocument;
import com.flamingo.ai.docinsight.service.structure.model.DetectedTitle;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStructure;
import com.flamingo.ai.docinsight.service.structure.model.HeadingCandidate;
import com.flamingo.ai.docinsight.service.structure.model.NormalizedDocument;
import com.flamingo.ai.docinsight.service.structure.model.Section;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the structure pipeline for one document: normalize, detect title, classify headings,
 * segment sections.
 *
 * <p>Failures are isolated per document: any runtime error yields an empty structure, is logged
 * and counted, and never reaches the caller. The result is a pure function of the input runs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentStructureExtractor {

  private final LayoutNormalizer layoutNormalizer;
  private final TitleDetector titleDetector;
  private final HeadingClassifier headingClassifier;
  private final SectionSegmenter sectionSegmenter;
  private final MeterRegistry meterRegistry;

  public DocumentStructure extract(RawDocument document) {
    String documentId = document != null ? document.documentId() : null;
    try {
      NormalizedDocument normalized = layoutNormalizer.normalize(document);
      if (normalized.lines().isEmpty()) {
        log.info("Document {} has no extractable text, returning empty outline", documentId);
        return DocumentStructure.empty(documentId);
      }

      DetectedTitle title = titleDetector.detect(normalized);
      List<HeadingCandidate> classified = headingClassifier.classify(normalized, title);
      List<Section> sections = sectionSegmenter.segment(classified);

      DocumentStructure structure =
          new DocumentStructure(documentId, title, classified, sections, normalized.stats());
      int headings = structure.outline().size();
      meterRegistry.counter("docinsight.headings.detected").increment(headings);
      log.debug(
          "Document {}: title='{}', {} headings, {} sections",
          documentId,
          title.text(),
          headings,
          sections.size());
      return structure;
    } catch (RuntimeException e) {
      meterRegistry.counter("docinsight.documents.failed", "stage", "structure").increment();
      log.warn("Structure extraction failed for {}: {}", documentId, e.getMessage(), e);
      return DocumentStructure.empty(documentId);
    }
  }
}
