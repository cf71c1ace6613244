package com.flamingo.ai.chunker.service.header;

import com.flamingo.ai.chunker.config.ChunkingConfig;
import com.flamingo.ai.chunker.exception.DocumentProcessingException;
import com.flamingo.ai.chunker.service.model.HeaderTable;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Reads the header table out of a DOCX archive.
 *
 * <p>Opens the configured header part (by default {@code word/header1.xml}) and walks its
 * WordprocessingML with the JDK DOM:
 *
 * <ul>
 *   <li>{@code w:tbl/w:tr/w:tc} → rows and cells
 *   <li>first {@code w:p} of each cell → the cell's paragraph
 *   <li>{@code w:r/w:t} → literal runs; {@code w:fldSimple/w:r/w:t} → field runs
 * </ul>
 *
 * <p>A header part without a table yields an empty {@link HeaderTable}; a missing header part
 * yields {@link Optional#empty()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HeaderArchiveReader {

  static final String W_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";

  private final ChunkingConfig config;

  /**
   * Reads the header table of a Word document.
   *
   * @param docx raw DOCX bytes
   * @param fileName file name for error reporting
   * @return the header table, or empty if the archive has no header part
   * @throws DocumentProcessingException if the archive or the header XML cannot be read
   */
  public Optional<HeaderTable> read(byte[] docx, String fileName) {
    String entryName = config.getHeader().getEntryName();
    try {
      Optional<byte[]> headerXml = readEntry(docx, entryName);
      if (headerXml.isEmpty()) {
        log.debug("No {} entry in {}", entryName, fileName);
        return Optional.empty();
      }
      return Optional.of(parseHeader(headerXml.get()));
    } catch (IOException | ParserConfigurationException | SAXException e) {
      throw new DocumentProcessingException(
          fileName, "Failed to read header of " + fileName + ": " + e.getMessage(), e);
    }
  }

  private Optional<byte[]> readEntry(byte[] archive, String entryName) throws IOException {
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(archive))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (entryName.equals(entry.getName())) {
          return Optional.of(zip.readAllBytes());
        }
      }
    }
    return Optional.empty();
  }

  HeaderTable parseHeader(byte[] xml)
      throws ParserConfigurationException, SAXException, IOException {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xml));
    dom.getDocumentElement().normalize();

    NodeList tables = dom.getElementsByTagNameNS(W_NS, "tbl");
    if (tables.getLength() == 0) {
      log.warn("Header part has no table; metadata fields will be empty");
      return new HeaderTable(List.of());
    }

    List<HeaderTable.Row> rows = new ArrayList<>();
    for (Element tr : children((Element) tables.item(0), "tr")) {
      List<HeaderTable.Cell> cells = new ArrayList<>();
      for (Element tc : children(tr, "tc")) {
        cells.add(readCell(tc));
      }
      rows.add(new HeaderTable.Row(cells));
    }
    return new HeaderTable(rows);
  }

  private HeaderTable.Cell readCell(Element tc) {
    List<Element> paragraphs = children(tc, "p");
    if (paragraphs.isEmpty()) {
      return new HeaderTable.Cell(List.of(), List.of());
    }
    Element paragraph = paragraphs.get(0);

    List<HeaderTable.Run> runs = new ArrayList<>();
    for (Element r : children(paragraph, "r")) {
      runs.add(readRun(r));
    }
    List<HeaderTable.Run> fieldRuns = new ArrayList<>();
    for (Element field : children(paragraph, "fldSimple")) {
      for (Element r : children(field, "r")) {
        fieldRuns.add(readRun(r));
      }
    }
    return new HeaderTable.Cell(runs, fieldRuns);
  }

  private HeaderTable.Run readRun(Element r) {
    List<Element> texts = children(r, "t");
    if (texts.isEmpty()) {
      return new HeaderTable.Run(null);
    }
    StringBuilder sb = new StringBuilder();
    for (Element t : texts) {
      sb.append(t.getTextContent());
    }
    return new HeaderTable.Run(sb.toString());
  }

  private List<Element> children(Element parent, String localName) {
    List<Element> result = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE
          && W_NS.equals(node.getNamespaceURI())
          && localName.equals(node.getLocalName())) {
        result.add((Element) node);
      }
    }
    return result;
  }
}
