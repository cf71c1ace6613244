package com.flamingo.ai.chunker.service.model;

/**
 * Document-level provenance fields read from a procedure's header.
 *
 * <p>Every field is trimmed with its label prefix removed; a field that could not be read is the
 * empty string, never {@code null}.
 *
 * @param documentTitle procedure title, e.g. {@code "Software Change Control"}
 * @param documentNumber procedure number, e.g. {@code "MSC-001"}
 * @param revision revision label
 * @param effectiveDate effective date as written in the header
 */
public record DocumentHeaderMetadata(
    String documentTitle, String documentNumber, String revision, String effectiveDate) {

  public DocumentHeaderMetadata {
    documentTitle = documentTitle == null ? "" : documentTitle;
    documentNumber = documentNumber == null ? "" : documentNumber;
    revision = revision == null ? "" : revision;
    effectiveDate = effectiveDate == null ? "" : effectiveDate;
  }

  /** Metadata with every field empty. */
  public static DocumentHeaderMetadata empty() {
    return new DocumentHeaderMetadata("", "", "", "");
  }
}
