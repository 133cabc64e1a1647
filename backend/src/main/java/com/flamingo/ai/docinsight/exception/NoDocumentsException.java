package com.flamingo.ai.docinsight.exception;

/** Exception thrown when a request or batch run carries no readable input at all. */
public class NoDocumentsException extends RuntimeException {

  public NoDocumentsException(String message) {
    super(message);
  }
}
