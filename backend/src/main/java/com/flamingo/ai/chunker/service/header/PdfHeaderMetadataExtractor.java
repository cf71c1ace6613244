package com.flamingo.ai.chunker.service.header;

import com.flamingo.ai.chunker.config.ChunkingConfig;
import com.flamingo.ai.chunker.service.model.DocumentHeaderMetadata;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts procedure metadata from the labelled header lines at the top of a PDF's first page.
 *
 * <p>PDFs carry no header table, so the header is recovered from text such as {@code "Procedure
 * Title: Software Change Control"} and {@code "Number: MSC-001 Effective: 01/02/2024 Revision:
 * 3"}. Each label's value runs to the next label or the end of the line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfHeaderMetadataExtractor {

  private static final Pattern PAGE_MARKER =
      Pattern.compile("(?m)^[ \\t]*--[ \\t]*\\d+[ \\t]+of[ \\t]+\\d+[ \\t]*--[ \\t]*$");

  private static final Map<HeaderField, Pattern> FIELD_PATTERNS = new EnumMap<>(HeaderField.class);

  static {
    for (HeaderField field : HeaderField.values()) {
      FIELD_PATTERNS.put(
          field,
          Pattern.compile(
              Pattern.quote(field.label())
                  + "[ \\t]*(.*?)[ \\t]*(?="
                  + HeaderField.ANY_LABEL
                  + "|$)",
              Pattern.CASE_INSENSITIVE | Pattern.MULTILINE));
    }
  }

  private final ChunkingConfig config;

  /**
   * Extracts metadata from the raw (uncleansed) text of a PDF.
   *
   * @param text extracted PDF text including page markers
   * @return metadata; labels that are absent yield empty fields
   */
  public DocumentHeaderMetadata extract(String text) {
    if (text == null || text.isBlank()) {
      return DocumentHeaderMetadata.empty();
    }
    String headerArea = headerArea(text);

    Map<HeaderField, String> values = new EnumMap<>(HeaderField.class);
    for (Map.Entry<HeaderField, Pattern> entry : FIELD_PATTERNS.entrySet()) {
      Matcher matcher = entry.getValue().matcher(headerArea);
      values.put(entry.getKey(), matcher.find() ? matcher.group(1).trim() : "");
    }

    DocumentHeaderMetadata metadata =
        new DocumentHeaderMetadata(
            values.get(HeaderField.TITLE),
            values.get(HeaderField.NUMBER),
            values.get(HeaderField.REVISION),
            values.get(HeaderField.EFFECTIVE));
    if (metadata.documentNumber().isEmpty()) {
      log.warn("No procedure number found in PDF header area");
    }
    return metadata;
  }

  /** First page, limited to the configured number of non-blank lines. */
  private String headerArea(String text) {
    Matcher marker = PAGE_MARKER.matcher(text);
    String firstPage = marker.find() ? text.substring(0, marker.start()) : text;

    int limit = config.getPdf().getHeaderScanLines();
    StringBuilder area = new StringBuilder();
    int taken = 0;
    for (String line : firstPage.split("\n")) {
      if (line.isBlank()) {
        continue;
      }
      area.append(line).append('\n');
      if (++taken >= limit) {
        break;
      }
    }
    return area.toString();
  }
}
