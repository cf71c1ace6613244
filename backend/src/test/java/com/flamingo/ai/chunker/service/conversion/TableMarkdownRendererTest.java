package com.flamingo.ai.chunker.service.conversion;

import static org.assertj.core.api.Assertions.assertThat;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TableMarkdownRenderer Tests")
class TableMarkdownRendererTest {

  private final TableMarkdownRenderer renderer = new TableMarkdownRenderer();

  private static Element table(String html) {
    return Jsoup.parse(html).selectFirst("table");
  }

  @Test
  @DisplayName("should render header separator under the first row")
  void shouldRenderSeparatorUnderFirstRow() {
    Element table =
        table(
            "<table><tr><th>Step</th><th>Owner</th></tr>"
                + "<tr><td>Review</td><td>QA</td></tr></table>");

    assertThat(renderer.render(table))
        .isEqualTo("| Step | Owner |\n| --- | --- |\n| Review | QA |");
  }

  @Test
  @DisplayName("should escape pipes and collapse whitespace in cells")
  void shouldEscapePipes() {
    Element table = table("<table><tr><td>a | b</td><td>  spaced\n  out </td></tr></table>");

    assertThat(renderer.render(table)).isEqualTo("| a \\| b | spaced out |\n| --- | --- |");
  }

  @Test
  @DisplayName("should return empty string for a table without cells")
  void shouldReturnEmpty_whenNoCells() {
    assertThat(renderer.render(table("<table><tr></tr></table>"))).isEmpty();
  }

  @Test
  @DisplayName("should always start with a pipe so chunking treats it as a table")
  void shouldStartWithPipe() {
    String markdown = renderer.render(table("<table><tr><td>only</td></tr></table>"));

    assertThat(markdown).startsWith("|");
  }

  @Test
  @DisplayName("should keep a nested table inside its cell instead of adding its rows")
  void shouldNotRenderNestedRows_whenCellHoldsTable() {
    Element table =
        table(
            "<table><thead><tr><th>Step</th><th>Detail</th></tr></thead><tbody>"
                + "<tr><td>Review</td><td><table><tr><td>inner</td><td>x</td></tr></table></td>"
                + "</tr></tbody></table>");

    assertThat(renderer.render(table))
        .isEqualTo("| Step | Detail |\n| --- | --- |\n| Review | inner x |");
  }
}
