package com.flamingo.ai.chunker.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunker.config.ChunkingConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TableAwareChunker Tests")
class TableAwareChunkerTest {

  private static final String TABLE = "| A | B |\n| --- | --- |\n| 1 | 2 |";

  private TableAwareChunker chunker;

  @BeforeEach
  void setUp() {
    chunker = new TableAwareChunker(new ChunkingConfig());
  }

  /** A paragraph of {@code count} distinct words, each prefixed with {@code tag}. */
  static String paragraph(String tag, int count) {
    return IntStream.range(0, count).mapToObj(i -> tag + i).collect(Collectors.joining(" "));
  }

  static String join(List<String> sections) {
    return String.join("\n\n", sections);
  }

  @Test
  @DisplayName("should isolate a table between two paragraphs without overlap")
  void shouldIsolateTable_betweenParagraphs() {
    String text = "Intro paragraph one.\n\n" + TABLE + "\n\nClosing paragraph.";

    List<String> chunks = chunker.partition(text);

    assertThat(chunks).containsExactly("Intro paragraph one.", TABLE, "Closing paragraph.");
  }

  @Test
  @DisplayName("should return no chunks for blank input")
  void shouldReturnNoChunks_whenInputBlank() {
    assertThat(chunker.partition("")).isEmpty();
    assertThat(chunker.partition("\n\n  \n\n")).isEmpty();
    assertThat(chunker.partition(null)).isEmpty();
  }

  @Test
  @DisplayName("should keep a single short paragraph as one chunk")
  void shouldKeepShortText_asOneChunk() {
    assertThat(chunker.partition("Just one paragraph.")).containsExactly("Just one paragraph.");
  }

  @Test
  @DisplayName("should accumulate paragraphs up to the target and repeat the last as overlap")
  void shouldOverlapByTrailingSection_whenParagraphsAreLarge() {
    List<String> sections = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      sections.add(paragraph("p" + i + "w", 100));
    }

    List<String> chunks = chunker.partition(join(sections));

    assertThat(chunks)
        .containsExactly(
            join(sections.subList(0, 4)),
            join(sections.subList(3, 7)),
            join(sections.subList(6, 10)));
  }

  @Test
  @DisplayName("should rewind over enough small sections to reach the overlap window")
  void shouldRewindSeveralSections_whenSectionsAreSmall() {
    List<String> sections = new ArrayList<>();
    for (int i = 0; i < 25; i++) {
      sections.add(paragraph("s" + i + "w", 20));
    }

    List<String> chunks = chunker.partition(join(sections));

    assertThat(chunks).hasSize(2);
    assertThat(chunks.get(0)).isEqualTo(join(sections.subList(0, 20)));
    assertThat(chunks.get(1)).isEqualTo(join(sections.subList(17, 25)));
  }

  @Test
  @DisplayName("should include an oversized paragraph whole instead of splitting it")
  void shouldKeepOversizedParagraphWhole() {
    String huge = paragraph("h", 600);
    String next = paragraph("n", 30);

    List<String> chunks = chunker.partition(huge + "\n\n" + next);

    assertThat(chunks).containsExactly(huge, next);
    assertThat(TableAwareChunker.countWords(chunks.get(0))).isEqualTo(600);
  }

  @Test
  @DisplayName("should stop before a paragraph that would exceed the ceiling")
  void shouldStopBeforeSection_whenCeilingWouldBeExceeded() {
    String first = paragraph("a", 300);
    String second = paragraph("b", 150);
    String third = paragraph("c", 100);

    List<String> chunks = chunker.partition(join(List.of(first, second, third)));

    assertThat(chunks.get(0)).isEqualTo(join(List.of(first, second)));
    assertThat(chunks.get(1)).startsWith(second);
    for (String chunk : chunks) {
      assertThat(TableAwareChunker.countWords(chunk)).isLessThanOrEqualTo(480);
    }
  }

  @Test
  @DisplayName("should never merge a table with neighbouring text or overlap after it")
  void shouldNeverMergeTables_inLongDocument() {
    List<String> sections = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      sections.add(paragraph("x" + i + "w", 90));
    }
    sections.add(3, TABLE);
    String text = join(sections);

    List<String> chunks = chunker.partition(text);

    List<String> tableChunks = chunks.stream().filter(TableAwareChunker::isTable).toList();
    assertThat(tableChunks).containsExactly(TABLE);
    int tableAt = chunks.indexOf(TABLE);
    assertThat(chunks.get(tableAt - 1)).doesNotContain("|");
    assertThat(chunks.get(tableAt + 1)).startsWith(sections.get(4));
  }

  @Test
  @DisplayName("should share a trailing section between consecutive text chunks")
  void shouldShareTrailingSection_betweenConsecutiveChunks() {
    List<String> sections = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      sections.add(paragraph("o" + i + "w", 70 + i * 5));
    }

    List<String> chunks = chunker.partition(join(sections));

    assertThat(chunks).hasSizeGreaterThan(1);
    for (int c = 1; c < chunks.size(); c++) {
      String[] previous = chunks.get(c - 1).split("\n\n");
      assertThat(chunks.get(c)).startsWith(previous[previous.length - 1]);
    }
  }

  @Test
  @DisplayName("should split on blank lines that contain whitespace")
  void shouldSplitOnWhitespaceOnlyBlankLines() {
    List<String> chunks = chunker.partition("First.\n   \n" + TABLE);

    assertThat(chunks).containsExactly("First.", TABLE);
  }

  @Test
  @DisplayName("should honour a configured target size")
  void shouldHonourConfiguredTarget() {
    ChunkingConfig config = new ChunkingConfig();
    config.setTargetWords(10);
    config.setOverlapWords(0);
    TableAwareChunker small = new TableAwareChunker(config);

    List<String> chunks =
        small.partition(join(List.of(paragraph("a", 6), paragraph("b", 6), paragraph("c", 6))));

    assertThat(chunks)
        .containsExactly(
            join(List.of(paragraph("a", 6), paragraph("b", 6))), paragraph("c", 6));
  }

  @Test
  @DisplayName("should count words on runs of whitespace")
  void shouldCountWords() {
    assertThat(TableAwareChunker.countWords("  one\ttwo \n three  ")).isEqualTo(3);
    assertThat(TableAwareChunker.countWords("")).isZero();
    assertThat(TableAwareChunker.countWords("   ")).isZero();
  }
}
