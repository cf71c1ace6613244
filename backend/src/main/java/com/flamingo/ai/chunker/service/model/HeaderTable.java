package com.flamingo.ai.chunker.service.model;

import com.flamingo.ai.chunker.exception.MalformedHeaderException;
import java.util.List;

/**
 * The table found in a Word document's header part.
 *
 * <p>Procedure headers put the title in row 0 and the number, effective date and revision in row
 * 1.
 */
public record HeaderTable(List<Row> rows) {

  public HeaderTable {
    rows = List.copyOf(rows);
  }

  /**
   * Returns the cell at the given position.
   *
   * @throws MalformedHeaderException if the row or cell does not exist
   */
  public Cell cell(int row, int index) {
    if (row < 0 || row >= rows.size()) {
      throw new MalformedHeaderException(row, index);
    }
    List<Cell> cells = rows.get(row).cells();
    if (index < 0 || index >= cells.size()) {
      throw new MalformedHeaderException(row, index);
    }
    return cells.get(index);
  }

  public record Row(List<Cell> cells) {
    public Row {
      cells = List.copyOf(cells);
    }
  }

  /**
   * One table cell holding a single paragraph.
   *
   * @param runs literal runs of the paragraph, in order
   * @param fieldRuns runs nested in simple field references, in order
   */
  public record Cell(List<Run> runs, List<Run> fieldRuns) {
    public Cell {
      runs = List.copyOf(runs);
      fieldRuns = List.copyOf(fieldRuns);
    }
  }

  /**
   * A run of text. Runs that only carry formatting (tabs, breaks, revision marks) have a {@code
   * null} text.
   */
  public record Run(String text) {
    public boolean hasText() {
      return text != null;
    }
  }
}
