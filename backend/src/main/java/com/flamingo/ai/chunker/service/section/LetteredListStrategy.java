package com.flamingo.ai.chunker.service.section;

import com.flamingo.ai.chunker.service.conversion.HtmlTextConverter;
import com.flamingo.ai.chunker.service.conversion.MarkupBlock;
import com.flamingo.ai.chunker.service.model.Section;
import com.flamingo.ai.chunker.service.model.SectionResult;
import com.flamingo.ai.chunker.service.model.SectionStrategy;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Detects sections laid out as a lettered list whose items open with a bold title.
 *
 * <p>A qualifying item looks like {@code <li><strong>Purpose.</strong> This procedure ...</li>}.
 * Qualifying items are given markers A to Z, then AA, AB and so on. A section runs from its item
 * to the next qualifying item and includes the blocks in between.
 *
 * <p>If any bold title is itself numbered (e.g. {@code "1.0 Scope"}) the document is numbered,
 * not lettered, and this strategy reports confidence 0.
 */
@Service
@Order(1)
public class LetteredListStrategy implements SectionDetectionStrategy {

  private static final Set<String> BOLD_TAGS = Set.of("strong", "b");
  private static final Pattern NUMERIC_TITLE = Pattern.compile("^\\d+(\\.\\d+)*\\.?(\\s|$)");

  @Override
  public SectionStrategy strategy() {
    return SectionStrategy.LETTERED;
  }

  @Override
  public SectionResult detect(List<MarkupBlock> blocks) {
    List<Integer> starts = new ArrayList<>();
    List<String> rawTitles = new ArrayList<>();
    int listItems = 0;

    for (int i = 0; i < blocks.size(); i++) {
      MarkupBlock block = blocks.get(i);
      if (!block.isListItem()) {
        continue;
      }
      listItems++;
      Optional<String> title = leadingBoldText(block.element());
      if (title.isEmpty()) {
        continue;
      }
      if (NUMERIC_TITLE.matcher(title.get()).find()) {
        return SectionResult.none(SectionStrategy.LETTERED);
      }
      starts.add(i);
      rawTitles.add(title.get());
    }

    if (starts.isEmpty()) {
      return SectionResult.none(SectionStrategy.LETTERED);
    }

    List<Section> sections = new ArrayList<>();
    for (int n = 0; n < starts.size(); n++) {
      int start = starts.get(n);
      int end = n + 1 < starts.size() ? starts.get(n + 1) : blocks.size();
      String rawTitle = rawTitles.get(n);

      List<String> parts = new ArrayList<>();
      String itemText = blocks.get(start).text();
      String remainder =
          itemText.startsWith(rawTitle) ? itemText.substring(rawTitle.length()).trim() : itemText;
      if (!remainder.isEmpty()) {
        parts.add(remainder);
      }
      for (MarkupBlock block : blocks.subList(start + 1, end)) {
        parts.add(block.text());
      }

      String marker = marker(n);
      sections.add(
          new Section(
              stripTrailingPeriod(rawTitle),
              String.join("\n\n", parts),
              new Section.Heading(SectionStrategy.LETTERED, marker)));
    }

    double ratio = (double) starts.size() / listItems;
    String preamble = HtmlTextConverter.joinBlocks(blocks.subList(0, starts.get(0)));
    return new SectionResult(
        SectionStrategy.LETTERED, sections, confidence(sections.size(), ratio), preamble);
  }

  /**
   * Confidence for {@code sections} detected sections, {@code ratio} of which list items
   * qualified.
   */
  static double confidence(int sections, double ratio) {
    if (sections >= 5 && ratio > 0.8) {
      return 0.9;
    }
    if (sections >= 3 && ratio > 0.7) {
      return 0.7;
    }
    if (sections >= 2 && ratio > 0.6) {
      return 0.5;
    }
    if (sections >= 1) {
      return 0.3;
    }
    return 0.0;
  }

  /** Letter marker of the zero-based {@code index}th section: A..Z, AA..AZ, BA... */
  static String marker(int index) {
    StringBuilder marker = new StringBuilder();
    for (int n = index + 1; n > 0; n = (n - 1) / 26) {
      marker.insert(0, (char) ('A' + (n - 1) % 26));
    }
    return marker.toString();
  }

  /** Text of the bold run the item opens with, looking through one wrapping paragraph. */
  private Optional<String> leadingBoldText(Element item) {
    Node first = firstMeaningfulChild(item);
    if (first instanceof Element el && "p".equals(el.normalName())) {
      first = firstMeaningfulChild(el);
    }
    if (first instanceof Element el && BOLD_TAGS.contains(el.normalName())) {
      String text = el.text().trim();
      return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
    return Optional.empty();
  }

  private Node firstMeaningfulChild(Element parent) {
    for (Node child : parent.childNodes()) {
      if (child instanceof TextNode text && text.isBlank()) {
        continue;
      }
      return child;
    }
    return null;
  }

  private String stripTrailingPeriod(String title) {
    return title.endsWith(".") ? title.substring(0, title.length() - 1).trim() : title;
  }
}
