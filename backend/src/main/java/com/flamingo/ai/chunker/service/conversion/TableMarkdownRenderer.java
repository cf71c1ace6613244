package com.flamingo.ai.chunker.service.conversion;

import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Renders an HTML {@code <table>} as a pipe-delimited Markdown block.
 *
 * <p>One row per line, with a {@code | --- | --- |} separator directly under the first row:
 *
 * <pre>
 * | Step | Owner |
 * | --- | --- |
 * | Review | QA |
 * </pre>
 *
 * <p>Cell text is whitespace-collapsed; literal pipes are escaped so they cannot open a new column.
 */
@Service
public class TableMarkdownRenderer {

  /** Rows of this table only; rows of a table nested in a cell stay part of that cell's text. */
  private static final String OWN_ROWS = "> tr, > thead > tr, > tbody > tr, > tfoot > tr";

  /**
   * Renders the table.
   *
   * @param table a {@code table} element
   * @return the Markdown block without a trailing newline, or the empty string if the table has no
   *     cells
   */
  public String render(Element table) {
    List<String> lines = new ArrayList<>();
    for (Element row : table.select(OWN_ROWS)) {
      List<String> cells = new ArrayList<>();
      for (Element cell : row.children()) {
        if ("td".equals(cell.normalName()) || "th".equals(cell.normalName())) {
          cells.add(cell.text().trim().replace("|", "\\|"));
        }
      }
      if (cells.isEmpty()) {
        continue;
      }
      lines.add("| " + String.join(" | ", cells) + " |");
      if (lines.size() == 1) {
        lines.add("| " + String.join(" | ", cells.stream().map(c -> "---").toList()) + " |");
      }
    }
    return String.join("\n", lines);
  }
}
