package com.flamingo.ai.chunker.service.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/** Container formats the chunker accepts. */
public enum SourceFormat {
  WORD(
      Set.of(
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "application/vnd.ms-word.document.macroEnabled.12"),
      Set.of(".docx", ".docm")),
  PDF(Set.of("application/pdf"), Set.of(".pdf"));

  private final Set<String> mimeTypes;
  private final Set<String> extensions;

  SourceFormat(Set<String> mimeTypes, Set<String> extensions) {
    this.mimeTypes = mimeTypes;
    this.extensions = extensions;
  }

  public boolean supports(String mimeType) {
    return mimeType != null && mimeTypes.contains(mimeType.toLowerCase(Locale.ROOT));
  }

  /**
   * Resolves the format from a MIME type, falling back to the file extension when the MIME type is
   * missing or generic.
   *
   * @param mimeType declared MIME type; may be {@code null}
   * @param fileName original file name; may be {@code null}
   * @return the matching format, or empty if neither identifies a supported format
   */
  public static Optional<SourceFormat> resolve(String mimeType, String fileName) {
    for (SourceFormat format : values()) {
      if (format.supports(mimeType)) {
        return Optional.of(format);
      }
    }
    if (fileName == null) {
      return Optional.empty();
    }
    String lower = fileName.toLowerCase(Locale.ROOT);
    for (SourceFormat format : values()) {
      if (format.extensions.stream().anyMatch(lower::endsWith)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }
}
