package com.flamingo.ai.chunker.service.conversion;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Service;

/**
 * Flattens body markup into an ordered list of {@link MarkupBlock}s.
 *
 * <p>Walks the body depth-first:
 *
 * <ul>
 *   <li>{@code <h1>}–{@code <h6>} → heading blocks
 *   <li>{@code <table>} → one table block rendered through {@link TableMarkdownRenderer}
 *   <li>{@code <p>}, {@code <pre>}, {@code <blockquote>} → paragraph blocks
 *   <li>{@code <li>} → a list item block holding the item's own text; nested lists follow it as
 *       their own items
 *   <li>other elements are descended into; loose text between blocks becomes a paragraph
 * </ul>
 *
 * <p>Inline images carrying a {@code data:} URI are kept as their URI text so that cleansing can
 * replace them; other images are dropped. The input document is never modified.
 */
@Service
@RequiredArgsConstructor
public class MarkupBlockReader {

  private static final Set<String> PARAGRAPH_TAGS = Set.of("p", "pre", "blockquote");
  private static final Set<String> LIST_TAGS = Set.of("ul", "ol");
  private static final Set<String> SKIPPED_TAGS = Set.of("script", "style", "head", "br", "img");

  private final TableMarkdownRenderer tableRenderer;

  public List<MarkupBlock> read(Document markup) {
    Document copy = markup.clone();
    for (Element img : copy.select("img")) {
      String src = img.attr("src");
      if (src.startsWith("data:")) {
        img.replaceWith(new TextNode(" " + src + " "));
      } else {
        img.remove();
      }
    }

    List<MarkupBlock> blocks = new ArrayList<>();
    walk(copy.body(), blocks);
    return blocks;
  }

  private void walk(Element parent, List<MarkupBlock> blocks) {
    for (Node child : parent.childNodes()) {
      if (child instanceof TextNode textNode) {
        String text = textNode.text().trim();
        if (!text.isEmpty()) {
          blocks.add(new MarkupBlock(MarkupBlock.Kind.PARAGRAPH, 0, null, text));
        }
        continue;
      }
      if (!(child instanceof Element el)) {
        continue;
      }
      String tag = el.normalName();

      if (tag.matches("h[1-6]")) {
        int level = Integer.parseInt(tag.substring(1));
        addIfNotBlank(blocks, MarkupBlock.Kind.HEADING, level, el, el.text());
      } else if ("table".equals(tag)) {
        addIfNotBlank(blocks, MarkupBlock.Kind.TABLE, 0, el, tableRenderer.render(el));
      } else if (PARAGRAPH_TAGS.contains(tag)) {
        String text = "pre".equals(tag) ? el.wholeText().strip() : el.text();
        addIfNotBlank(blocks, MarkupBlock.Kind.PARAGRAPH, 0, el, text);
      } else if ("li".equals(tag)) {
        readListItem(el, blocks);
      } else if (!SKIPPED_TAGS.contains(tag)) {
        walk(el, blocks);
      }
    }
  }

  private void readListItem(Element li, List<MarkupBlock> blocks) {
    Element own = li.clone();
    own.children().stream().filter(c -> LIST_TAGS.contains(c.normalName())).forEach(Node::remove);
    addIfNotBlank(blocks, MarkupBlock.Kind.LIST_ITEM, 0, li, own.text());

    for (Element nested : li.children()) {
      if (LIST_TAGS.contains(nested.normalName())) {
        walk(nested, blocks);
      }
    }
  }

  private void addIfNotBlank(
      List<MarkupBlock> blocks, MarkupBlock.Kind kind, int level, Element el, String text) {
    String trimmed = text.trim();
    if (!trimmed.isEmpty()) {
      blocks.add(new MarkupBlock(kind, level, el, trimmed));
    }
  }
}
