package com.flamingo.ai.chunker.service.conversion;

import com.flamingo.ai.chunker.exception.DocumentProcessingException;
import com.flamingo.ai.chunker.service.header.HeaderArchiveReader;
import com.flamingo.ai.chunker.service.model.DecodedDocument;
import com.flamingo.ai.chunker.service.model.HeaderTable;
import com.flamingo.ai.chunker.service.model.SourceFormat;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.sax.ToXMLContentHandler;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * {@link DocumentDecoder} for Word documents (DOCX, DOCM).
 *
 * <p>The body is converted to XHTML with Apache Tika's {@link AutoDetectParser} and a {@link
 * ToXMLContentHandler}. Tika renders the page header and footer as {@code div.header} and {@code
 * div.footer}; those are removed from the body since the header is read separately as a table by
 * {@link HeaderArchiveReader}. Word list numbering, which Tika drops, is put back as {@code <ol>}
 * markup by {@link WordListNumbering}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TikaWordDocumentDecoder implements DocumentDecoder {

  private static final String DOCX_MIME_TYPE =
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

  private final HeaderArchiveReader headerReader;
  private final WordListNumbering listNumbering;

  @Override
  public DecodedDocument decode(byte[] content, String fileName) {
    HeaderTable header = headerReader.read(content, fileName).orElse(null);
    try (InputStream in = new ByteArrayInputStream(content)) {
      String xhtml = toXhtml(in);
      Document markup = Jsoup.parse(xhtml);
      markup.select("div.header, div.footer").remove();
      listNumbering.restore(markup, content, fileName);
      log.debug("Tika produced {} chars of XHTML for {}", xhtml.length(), fileName);
      return new DecodedDocument(fileName, SourceFormat.WORD, markup.outerHtml(), header);
    } catch (IOException | SAXException | TikaException e) {
      log.error("Tika failed to convert {}: {}", fileName, e.getMessage());
      throw new DocumentProcessingException(
          fileName, "Failed to parse Word document: " + e.getMessage(), e);
    }
  }

  @Override
  public SourceFormat format() {
    return SourceFormat.WORD;
  }

  private String toXhtml(InputStream in) throws IOException, SAXException, TikaException {
    AutoDetectParser tikaParser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, DOCX_MIME_TYPE);
    tikaParser.parse(in, handler, metadata);
    return out.toString(StandardCharsets.UTF_8);
  }
}
