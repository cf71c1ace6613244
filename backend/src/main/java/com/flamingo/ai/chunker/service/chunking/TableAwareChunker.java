package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.config.ChunkingConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Partitions cleansed text into word-bounded chunks with overlap, keeping Markdown tables whole.
 *
 * <p>The text is split on blank lines into stripped sections (paragraphs or table blocks).
 * Sections are accumulated greedily until the target word count is reached:
 *
 * <ul>
 *   <li>the first section of a chunk is always taken, even if it alone exceeds the ceiling
 *   <li>a table block is always a chunk of its own
 *   <li>a section that would push the chunk past {@code target × overflowFactor} is left for the
 *       next chunk
 * </ul>
 *
 * <p>After a text chunk, the read position is rewound over trailing sections worth about {@code
 * overlapWords} words so the next chunk repeats them. Never more than all but the first section
 * is rewound, so every chunk makes progress. No overlap follows a table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TableAwareChunker {

  private static final Pattern BLANK_LINE = Pattern.compile("\\n\\s*\\n");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final ChunkingConfig config;

  /**
   * Partitions the text.
   *
   * @param text cleansed plain text with tables rendered as pipe blocks
   * @return chunk contents in order; empty for blank input
   */
  public List<String> partition(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> sections =
        Arrays.stream(BLANK_LINE.split(text)).map(String::strip).filter(s -> !s.isEmpty()).toList();

    int targetWords = config.getTargetWords();
    double maxWords = config.maxWords();
    int overlapWords = config.getOverlapWords();

    List<String> chunks = new ArrayList<>();
    int i = 0;
    while (i < sections.size()) {
      List<String> current = new ArrayList<>();
      int wordCount = 0;

      while (i < sections.size() && wordCount < targetWords) {
        String section = sections.get(i);
        int sectionWords = countWords(section);
        boolean table = isTable(section);

        if (current.isEmpty()) {
          current.add(section);
          wordCount += sectionWords;
          i++;
          if (table) {
            break;
          }
        } else if (table || wordCount + sectionWords > maxWords) {
          break;
        } else {
          current.add(section);
          wordCount += sectionWords;
          i++;
        }
      }

      chunks.add(String.join("\n\n", current));

      boolean endedOnTable = isTable(current.get(current.size() - 1));
      if (!endedOnTable && i < sections.size()) {
        int overlap = 0;
        int steps = 0;
        while (overlap < overlapWords && steps < current.size() - 1) {
          steps++;
          overlap += countWords(sections.get(i - steps));
        }
        i -= steps;
      }
    }

    log.debug("Partitioned {} sections into {} chunks", sections.size(), chunks.size());
    return chunks;
  }

  /** Number of whitespace-separated words. */
  public static int countWords(String text) {
    if (text == null) {
      return 0;
    }
    return (int) Arrays.stream(WHITESPACE.split(text)).filter(w -> !w.isEmpty()).count();
  }

  /** Whether the content is a Markdown table block. */
  public static boolean isTable(String content) {
    return content != null && content.trim().startsWith("|");
  }
}
