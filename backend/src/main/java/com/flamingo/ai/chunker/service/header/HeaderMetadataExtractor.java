package com.flamingo.ai.chunker.service.header;

import com.flamingo.ai.chunker.exception.MalformedHeaderException;
import com.flamingo.ai.chunker.exception.MissingHeaderException;
import com.flamingo.ai.chunker.service.model.DocumentHeaderMetadata;
import com.flamingo.ai.chunker.service.model.HeaderTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts the four canonical procedure fields from a Word header table.
 *
 * <p>Layout:
 *
 * <ul>
 *   <li>row 0, cell 1 → document title
 *   <li>row 1, cells 1, 2, 3 → document number, effective date, revision
 * </ul>
 *
 * <p>A missing cell degrades that field to the empty string; only a missing header table aborts.
 */
@Service
@Slf4j
public class HeaderMetadataExtractor {

  /**
   * Extracts metadata from the given header table.
   *
   * @param header parsed header table; {@code null} when the document has none
   * @param fileName file name for error reporting
   * @return extracted metadata
   * @throws MissingHeaderException if {@code header} is {@code null}
   */
  public DocumentHeaderMetadata extract(HeaderTable header, String fileName) {
    if (header == null) {
      throw new MissingHeaderException(fileName);
    }

    String title = field(header, 0, 1, fileName);
    String number = field(header, 1, 1, fileName);
    String effective = field(header, 1, 2, fileName);
    String revision = field(header, 1, 3, fileName);

    log.debug(
        "Header metadata for {}: title='{}', number='{}', effective='{}', revision='{}'",
        fileName,
        title,
        number,
        effective,
        revision);
    return new DocumentHeaderMetadata(title, number, revision, effective);
  }

  /**
   * Concatenates the literal and field runs of a cell and strips its label prefix.
   *
   * @param cell header table cell
   * @return cleaned cell text
   */
  public String cellText(HeaderTable.Cell cell) {
    StringBuilder text = new StringBuilder();
    for (HeaderTable.Run run : cell.runs()) {
      if (run.hasText()) {
        text.append(run.text());
      }
    }
    for (HeaderTable.Run run : cell.fieldRuns()) {
      if (run.hasText()) {
        text.append(run.text());
      }
    }
    return HeaderField.stripLabel(text.toString());
  }

  private String field(HeaderTable header, int row, int index, String fileName) {
    try {
      return cellText(header.cell(row, index));
    } catch (MalformedHeaderException e) {
      log.warn("Malformed header in {}: {}", fileName, e.getMessage());
      return "";
    }
  }
}
