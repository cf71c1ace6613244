package com.flamingo.ai.chunker.service.conversion;

import org.jsoup.nodes.Element;

/**
 * A block-level unit of body markup in document order.
 *
 * @param kind block kind
 * @param level heading depth 1–6 for {@link Kind#HEADING}, 0 otherwise
 * @param element source element; {@code null} for bare text between blocks
 * @param text plain text of the block; Markdown for tables
 */
public record MarkupBlock(Kind kind, int level, Element element, String text) {

  public enum Kind {
    HEADING,
    PARAGRAPH,
    LIST_ITEM,
    TABLE
  }

  public boolean isListItem() {
    return kind == Kind.LIST_ITEM;
  }

  public boolean isHeading() {
    return kind == Kind.HEADING;
  }
}
