package com.flamingo.ai.chunker.service.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of content a chunk carries. */
public enum ContentType {
  TEXT("text"),
  TABLE("table");

  private final String value;

  ContentType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
