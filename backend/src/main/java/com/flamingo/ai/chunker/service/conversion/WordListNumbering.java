package com.flamingo.ai.chunker.service.conversion;

import com.flamingo.ai.chunker.exception.DocumentProcessingException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Service;

/**
 * Restores the list structure of a Word document that Tika flattens into plain paragraphs.
 *
 * <p>Tika renders a numbered or lettered Word paragraph as an ordinary {@code <p>} without its
 * number. The numbering of each top-level body paragraph is read with Apache POI ({@link
 * XWPFParagraph#getNumID()}, {@link XWPFParagraph#getNumIlvl()}) and the matching markup
 * paragraphs are turned into {@code <li>} items of an {@code <ol>}, one list per run of
 * consecutive numbered paragraphs, nested by list level.
 *
 * <p>Markup and POI paragraphs are paired in document order by their whitespace-collapsed text.
 * Paragraphs inside tables and existing lists are left alone. Numbered headings stay headings.
 */
@Service
@Slf4j
public class WordListNumbering {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** A number or bullet Tika may render in front of the paragraph text. */
  private static final Pattern MARKER_PREFIX =
      Pattern.compile("^(\\(?([A-Za-z]{1,3}|\\d+(\\.\\d+)*)[.)]?|[•·▪\\-])$");

  /**
   * Wraps the numbered paragraphs of {@code markup} in ordered lists.
   *
   * @param markup Tika's XHTML, parsed; modified in place
   * @param content the DOCX package
   * @param fileName used for logging and errors
   * @return number of list items created
   */
  public int restore(Document markup, byte[] content, String fileName) {
    List<BodyParagraph> paragraphs = readParagraphs(content, fileName);
    if (paragraphs.stream().noneMatch(BodyParagraph::numbered)) {
      return 0;
    }

    Deque<Element> lists = new ArrayDeque<>();
    int baseLevel = 0;
    int cursor = 0;
    int items = 0;
    for (Element block : markup.body().select("p, h1, h2, h3, h4, h5, h6")) {
      if (insideTableOrList(block)) {
        continue;
      }
      String text = block.text();
      if (text.isEmpty()) {
        continue;
      }
      int match = find(paragraphs, cursor, text);
      if (match < 0) {
        lists.clear();
        continue;
      }
      cursor = match + 1;
      BodyParagraph paragraph = paragraphs.get(match);
      if (!paragraph.numbered() || !"p".equals(block.normalName())) {
        lists.clear();
        continue;
      }

      stripMarker(block, text, paragraph.text());
      if (lists.isEmpty()) {
        Element list = new Element("ol");
        block.before(list);
        lists.push(list);
        baseLevel = paragraph.level();
      }
      int depth = Math.max(paragraph.level() - baseLevel, 0) + 1;
      while (lists.size() > depth) {
        lists.pop();
      }
      while (lists.size() < depth) {
        Element parent = lists.peek();
        Element host =
            parent.childrenSize() == 0
                ? parent.appendElement("li")
                : parent.child(parent.childrenSize() - 1);
        lists.push(host.appendElement("ol"));
      }
      lists.peek().appendChild(block.tagName("li"));
      items++;
    }
    log.debug("Restored {} numbered list items in {}", items, fileName);
    return items;
  }

  /** Top-level body paragraphs of the package, in document order. */
  List<BodyParagraph> readParagraphs(byte[] content, String fileName) {
    try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
      List<BodyParagraph> paragraphs = new ArrayList<>();
      for (IBodyElement element : document.getBodyElements()) {
        if (element instanceof XWPFParagraph paragraph) {
          paragraphs.add(new BodyParagraph(normalize(paragraph.getText()), level(paragraph)));
        }
      }
      return paragraphs;
    } catch (IOException | POIXMLException | UnsupportedFileFormatException e) {
      log.error("POI failed to read list numbering of {}: {}", fileName, e.getMessage());
      throw new DocumentProcessingException(
          fileName, "Failed to read Word list numbering: " + e.getMessage(), e);
    }
  }

  private static int level(XWPFParagraph paragraph) {
    BigInteger numId = paragraph.getNumID();
    if (numId == null || numId.signum() <= 0) {
      return -1;
    }
    BigInteger ilvl = paragraph.getNumIlvl();
    return ilvl == null ? 0 : ilvl.intValue();
  }

  private static int find(List<BodyParagraph> paragraphs, int from, String text) {
    for (int i = from; i < paragraphs.size(); i++) {
      String candidate = paragraphs.get(i).text();
      if (candidate.equals(text)) {
        return i;
      }
      if (!candidate.isEmpty() && text.endsWith(candidate) && isMarker(prefix(text, candidate))) {
        return i;
      }
    }
    return -1;
  }

  private static void stripMarker(Element block, String text, String paragraphText) {
    if (text.equals(paragraphText)) {
      return;
    }
    String marker = prefix(text, paragraphText);
    for (Node child : block.childNodes()) {
      if (child instanceof TextNode node && node.isBlank()) {
        continue;
      }
      if (child instanceof TextNode node && node.text().strip().startsWith(marker)) {
        node.text(node.text().strip().substring(marker.length()).stripLeading());
      }
      return;
    }
  }

  private static boolean insideTableOrList(Element block) {
    for (Element parent : block.parents()) {
      String tag = parent.normalName();
      if ("table".equals(tag) || "li".equals(tag)) {
        return true;
      }
    }
    return false;
  }

  private static String prefix(String text, String suffix) {
    return text.substring(0, text.length() - suffix.length()).strip();
  }

  private static boolean isMarker(String prefix) {
    return MARKER_PREFIX.matcher(prefix).matches();
  }

  private static String normalize(String text) {
    return text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ").strip();
  }

  /**
   * A Word body paragraph.
   *
   * @param text whitespace-collapsed text
   * @param level list level, or {@code -1} when the paragraph is not numbered
   */
  record BodyParagraph(String text, int level) {
    boolean numbered() {
      return level >= 0;
    }
  }
}
