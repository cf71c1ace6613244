package com.flamingo.ai.chunker.exception;

/** Exception thrown when no chunker handles a document's MIME type. */
public class UnsupportedDocumentTypeException extends RuntimeException {

  private final String mimeType;

  public UnsupportedDocumentTypeException(String mimeType) {
    super("Unsupported file type: " + mimeType);
    this.mimeType = mimeType;
  }

  public String getMimeType() {
    return mimeType;
  }
}
