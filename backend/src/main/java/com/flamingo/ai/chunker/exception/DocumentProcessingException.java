package com.flamingo.ai.chunker.exception;

/** Exception thrown when a document's binary container cannot be decoded. */
public class DocumentProcessingException extends RuntimeException {

  private final String fileName;
  private final String userMessage;

  public DocumentProcessingException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String fileName, String message, Throwable cause) {
    super(message, cause);
    this.fileName = fileName;
    this.userMessage = "Failed to process document";
  }

  public String getFileName() {
    return fileName;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
