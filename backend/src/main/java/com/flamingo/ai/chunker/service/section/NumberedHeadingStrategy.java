package com.flamingo.ai.chunker.service.section;

import com.flamingo.ai.chunker.service.conversion.HtmlTextConverter;
import com.flamingo.ai.chunker.service.conversion.MarkupBlock;
import com.flamingo.ai.chunker.service.model.Section;
import com.flamingo.ai.chunker.service.model.SectionResult;
import com.flamingo.ai.chunker.service.model.SectionStrategy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Detects sections introduced by numbered headings such as {@code <h1>1.0 Purpose</h1>}.
 *
 * <p>Only one heading level is used: the level with the most numbered headings, the shallower
 * level on a tie. Each section's content is everything between its heading and the next detected
 * heading, or the end of the document.
 */
@Service
@Order(2)
public class NumberedHeadingStrategy implements SectionDetectionStrategy {

  private static final Pattern NUMBERED_HEADING =
      Pattern.compile("^(\\d+(?:\\.\\d+)?)\\.?\\s+(\\S.*)$");

  @Override
  public SectionStrategy strategy() {
    return SectionStrategy.NUMBERED;
  }

  @Override
  public SectionResult detect(List<MarkupBlock> blocks) {
    Map<Integer, Integer> countsByLevel = new TreeMap<>();
    for (MarkupBlock block : blocks) {
      if (block.isHeading() && NUMBERED_HEADING.matcher(block.text()).matches()) {
        countsByLevel.merge(block.level(), 1, Integer::sum);
      }
    }
    if (countsByLevel.isEmpty()) {
      return SectionResult.none(SectionStrategy.NUMBERED);
    }
    int level = dominantLevel(countsByLevel);

    List<Integer> starts = new ArrayList<>();
    List<Matcher> headings = new ArrayList<>();
    for (int i = 0; i < blocks.size(); i++) {
      MarkupBlock block = blocks.get(i);
      if (!block.isHeading() || block.level() != level) {
        continue;
      }
      Matcher heading = NUMBERED_HEADING.matcher(block.text());
      if (heading.matches()) {
        starts.add(i);
        headings.add(heading);
      }
    }

    List<Section> sections = new ArrayList<>();
    for (int n = 0; n < starts.size(); n++) {
      int end = n + 1 < starts.size() ? starts.get(n + 1) : blocks.size();
      Matcher heading = headings.get(n);
      sections.add(
          new Section(
              heading.group(2).trim(),
              HtmlTextConverter.joinBlocks(blocks.subList(starts.get(n) + 1, end)),
              new Section.Heading(SectionStrategy.NUMBERED, heading.group(1))));
    }

    String preamble = HtmlTextConverter.joinBlocks(blocks.subList(0, starts.get(0)));
    return new SectionResult(
        SectionStrategy.NUMBERED, sections, confidence(sections.size()), preamble);
  }

  static double confidence(int sections) {
    if (sections >= 5) {
      return 0.9;
    }
    if (sections >= 3) {
      return 0.7;
    }
    if (sections >= 1) {
      return 0.4;
    }
    return 0.0;
  }

  // TreeMap iterates shallow levels first, so ties keep the shallower level
  private int dominantLevel(Map<Integer, Integer> countsByLevel) {
    int bestLevel = 0;
    int bestCount = 0;
    for (Map.Entry<Integer, Integer> entry : countsByLevel.entrySet()) {
      if (entry.getValue() > bestCount) {
        bestLevel = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    return bestLevel;
  }
}
