package com.flamingo.ai.docinsight.service.extraction.model;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * Named document bytes as received from an upload or read from disk.
 *
 * @param name file name, used as the document identifier
 * @param content raw PDF bytes
 */
public record DocumentSource(String name, byte[] content) {

  public InputStream openStream() {
    return new ByteArrayInputStream(content);
  }
}
