package com.flamingo.ai.chunker.service.cleansing;

import com.flamingo.ai.chunker.service.header.HeaderField;
import java.util.List;
import java.util.regex.Pattern;

/** The cleansing rules known to the chunker. */
public final class CleansingRules {

  private static final Pattern BASE64_IMAGE =
      Pattern.compile("data:image/[^;]+;base64,[A-Za-z0-9+/=]+");

  private static final Pattern PAGE_MARKER_LINE =
      Pattern.compile("(?m)^[ \\t]*--[ \\t]*\\d+[ \\t]+of[ \\t]+\\d+[ \\t]*--[ \\t]*$");

  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n[ \\t]*\\n(?:[ \\t]*\\n)+");

  private static final Pattern HEADER_LABEL =
      Pattern.compile(HeaderField.ANY_LABEL, Pattern.CASE_INSENSITIVE);

  private static final Pattern TITLE_LINE_START =
      Pattern.compile(
          "^[ \\t]*\\|?[ \\t]*" + Pattern.quote(HeaderField.TITLE.label()),
          Pattern.CASE_INSENSITIVE);

  /** Placeholder rewrites for signature and approval blanks, applied in this order. */
  private static final List<Replacement> SIGNATURE_REPLACEMENTS =
      List.of(
          new Replacement("Date:\\s*_{5,}", true, "Date: [SIGNATURE DATE REQUIRED]"),
          new Replacement("Name:\\s*_{5,}", true, "Name: [SIGNATURE FIELD]"),
          new Replacement("Title:\\s*_{5,}", true, "Title: [TO BE FILLED]"),
          new Replacement("Signature:\\s*_{5,}", true, "Signature: [SIGNATURE REQUIRED]"),
          new Replacement("Comments?:\\s*_{5,}", true, "Comments: [TO BE FILLED]"),
          new Replacement(
              "([A-Za-z\\s]*Approval):\\s*_{5,}", true, "$1: [APPROVAL SIGNATURE REQUIRED]"),
          new Replacement("([A-Za-z\\s]+):\\s*_{5,}", false, "$1: [TO BE FILLED]"),
          new Replacement("_{10,}", false, "[SIGNATURE LINE]"));

  private CleansingRules() {}

  /** Replaces embedded base64 image payloads with {@code [IMAGE]}. */
  public static TextCleansingRule imagePayloads() {
    return text -> BASE64_IMAGE.matcher(text).replaceAll("[IMAGE]");
  }

  /** Replaces underscore blanks after signature labels with descriptive placeholders. */
  public static TextCleansingRule signatureLines() {
    return text -> {
      String result = text;
      for (Replacement replacement : SIGNATURE_REPLACEMENTS) {
        result = replacement.apply(result);
      }
      return result;
    };
  }

  /** Removes {@code -- n of m --} page delimiter lines. */
  public static TextCleansingRule pageMarkers() {
    return text -> PAGE_MARKER_LINE.matcher(text).replaceAll("");
  }

  /**
   * Removes repeated procedure header lines: a line starting with the title label, or any line
   * carrying two or more header labels.
   */
  public static TextCleansingRule metadataHeaders() {
    return text -> {
      StringBuilder kept = new StringBuilder(text.length());
      String[] lines = text.split("\n", -1);
      for (int i = 0; i < lines.length; i++) {
        if (isHeaderLine(lines[i])) {
          continue;
        }
        kept.append(lines[i]);
        if (i < lines.length - 1) {
          kept.append('\n');
        }
      }
      return kept.toString();
    };
  }

  /** Collapses runs of blank lines left behind by line removal into a single blank line. */
  public static TextCleansingRule blankLineRuns() {
    return text -> EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
  }

  private static boolean isHeaderLine(String line) {
    if (TITLE_LINE_START.matcher(line).find()) {
      return true;
    }
    return HEADER_LABEL.matcher(line).results().limit(2).count() >= 2;
  }

  private record Replacement(Pattern pattern, String replacement) {

    Replacement(String regex, boolean ignoreCase, String replacement) {
      this(Pattern.compile(regex, ignoreCase ? Pattern.CASE_INSENSITIVE : 0), replacement);
    }

    String apply(String text) {
      return pattern.matcher(text).replaceAll(replacement);
    }
  }
}
