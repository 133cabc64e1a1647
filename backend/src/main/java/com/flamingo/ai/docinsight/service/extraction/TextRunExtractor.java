package com.flamingo.ai.docinsight.service.extraction;

import com.flamingo.ai.docinsight.service.extraction.model.RawDocument;
import java.io.InputStream;

/**
 * Turns raw document bytes into styled, positioned text runs.
 *
 * <p>Implementations must be stateless so one instance can serve concurrent documents.
 */
public interface TextRunExtractor {

  /**
   * Extracts the text runs of every page.
   *
   * <p>The caller retains ownership of {@code inputStream}; implementations must not close it.
   *
   * @param documentId identifier to attach to the result
   * @param inputStream raw document bytes
   * @return the runs grouped by page
   * @throws com.flamingo.ai.docinsight.exception.DocumentProcessingException if the document
   *     cannot be read
   */
  RawDocument extract(String documentId, InputStream inputStream);
}
