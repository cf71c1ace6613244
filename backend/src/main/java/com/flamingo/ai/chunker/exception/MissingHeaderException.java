package com.flamingo.ai.chunker.exception;

/**
 * Exception thrown when a document has no header container to read metadata from.
 *
 * <p>Chunking cannot attach provenance metadata without it, so processing of the document is
 * aborted. Retrying the same file will not change the outcome.
 */
public class MissingHeaderException extends RuntimeException {

  private final String fileName;

  public MissingHeaderException(String fileName) {
    super("Header not found in document: " + fileName);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
