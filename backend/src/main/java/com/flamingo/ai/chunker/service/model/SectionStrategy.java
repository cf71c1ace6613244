package com.flamingo.ai.chunker.service.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Heuristic used to detect a document's section structure.
 *
 * <p>Declaration order is the tie-break priority when two strategies report the same confidence.
 */
public enum SectionStrategy {
  LETTERED("lettered"),
  NUMBERED("numbered"),
  HEADING("heading"),
  FALLBACK("fallback");

  private final String value;

  SectionStrategy(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
