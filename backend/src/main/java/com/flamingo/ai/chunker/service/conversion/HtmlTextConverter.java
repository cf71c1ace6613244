package com.flamingo.ai.chunker.service.conversion;

import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

/**
 * Converts body markup to plain text for chunking.
 *
 * <p>Each block becomes one paragraph separated by a blank line. Tables are rendered as Markdown
 * before conversion so they survive as literal pipe blocks.
 */
@Service
@RequiredArgsConstructor
public class HtmlTextConverter {

  private final MarkupBlockReader blockReader;

  public String toText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    return toText(Jsoup.parse(html));
  }

  public String toText(Document markup) {
    return joinBlocks(blockReader.read(markup));
  }

  /** Joins block texts with blank-line separators. */
  public static String joinBlocks(List<MarkupBlock> blocks) {
    return blocks.stream().map(MarkupBlock::text).collect(Collectors.joining("\n\n"));
  }
}
