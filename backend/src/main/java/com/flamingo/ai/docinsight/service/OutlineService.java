package com.flamingo.ai.docinsight.service;

import com.flamingo.ai.docinsight.exception.DocumentProcessingException;
import com.flamingo.ai.docinsight.service.extraction.TextRunExtractor;
import com.flamingo.ai.docinsight.service.extraction.model.DocumentSource;
import com.flamingo.ai.docinsight.service.extraction.model.RawDocument;
import com.flamingo.ai.docinsight.service.structure.DocumentStructureExtractor;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStructure;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts the structure of a single document: text runs, then title, outline and sections.
 *
 * <p>Delegates reading to {@link TextRunExtractor} so this service has no knowledge of the PDF
 * library in use.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutlineService {

  private final TextRunExtractor textRunExtractor;
  private final DocumentStructureExtractor structureExtractor;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts the structure of a document, failing on unreadable input.
   *
   * @param source the document bytes
   * @return the document structure
   * @throws DocumentProcessingException if the document cannot be read
   */
  @Timed(value = "docinsight.outline", description = "Time to extract a document outline")
  public DocumentStructure outline(DocumentSource source) {
    RawDocument raw = textRunExtractor.extract(source.name(), source.openStream());
    DocumentStructure structure = structureExtractor.extract(raw);
    log.info(
        "Outline for {}: title='{}', {} headings",
        source.name(),
        structure.title().text(),
        structure.outline().size());
    return structure;
  }

  /**
   * Extracts the structure of a document, treating an unreadable one as empty.
   *
   * @param source the document bytes
   * @return the document structure, empty if the document cannot be read
   */
  public DocumentStructure outlineOrEmpty(DocumentSource source) {
    try {
      RawDocument raw = textRunExtractor.extract(source.name(), source.openStream());
      return structureExtractor.extract(raw);
    } catch (RuntimeException e) {
      meterRegistry.counter("docinsight.documents.failed", "stage", "extraction").increment();
      log.warn("Skipping unreadable document {}: {}", source.name(), e.getMessage());
      return DocumentStructure.empty(source.name());
    }
  }
}
