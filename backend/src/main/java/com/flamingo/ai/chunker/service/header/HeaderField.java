package com.flamingo.ai.chunker.service.header;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Labelled fields of a procedure header, in the order they appear. */
public enum HeaderField {
  TITLE("Procedure Title:"),
  NUMBER("Number:"),
  EFFECTIVE("Effective:"),
  REVISION("Revision:");

  /** Any header label, case-insensitive, for use inside larger expressions. */
  public static final String ANY_LABEL =
      Arrays.stream(values())
          .map(field -> Pattern.quote(field.label()))
          .collect(Collectors.joining("|", "(?:", ")"));

  private static final Pattern LEADING_LABEL =
      Pattern.compile("^" + ANY_LABEL + "\\s*", Pattern.CASE_INSENSITIVE);

  private final String label;

  HeaderField(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** Removes one leading header label and trims the result. */
  public static String stripLabel(String text) {
    return LEADING_LABEL.matcher(text).replaceFirst("").trim();
  }
}
