package com.flamingo.ai.chunker.service.model;

/**
 * A document whose binary container has already been decoded.
 *
 * @param fileName original file name, used for logging and error reporting
 * @param format container format the body came from
 * @param body XHTML markup for Word documents; plain text with page markers for PDFs
 * @param header parsed header table; {@code null} when the document has no header container
 */
public record DecodedDocument(
    String fileName, SourceFormat format, String body, HeaderTable header) {

  public boolean isBlank() {
    return body == null || body.isBlank();
  }
}
