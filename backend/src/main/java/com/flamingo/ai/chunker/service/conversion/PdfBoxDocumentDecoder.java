package com.flamingo.ai.chunker.service.conversion;

import com.flamingo.ai.chunker.exception.DocumentProcessingException;
import com.flamingo.ai.chunker.service.model.DecodedDocument;
import com.flamingo.ai.chunker.service.model.SourceFormat;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentDecoder} for PDF documents.
 *
 * <p>Uses Apache PDFBox 3.x to extract text page by page. Detected paragraph breaks become blank
 * lines and each page is followed by a {@code -- n of m --} marker line, which the PDF cleanser
 * strips after metadata has been read from the first page.
 */
@Service
@Slf4j
public class PdfBoxDocumentDecoder implements DocumentDecoder {

  @Override
  public DecodedDocument decode(byte[] content, String fileName) {
    try (PDDocument pdfDoc = Loader.loadPDF(content)) {
      String text = extractPages(pdfDoc);
      log.debug("PDFBox extracted {} pages from {}", pdfDoc.getNumberOfPages(), fileName);
      return new DecodedDocument(fileName, SourceFormat.PDF, text, null);
    } catch (IOException e) {
      log.error("PDFBox parsing failed for {}: {}", fileName, e.getMessage());
      throw new DocumentProcessingException(fileName, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public SourceFormat format() {
    return SourceFormat.PDF;
  }

  private String extractPages(PDDocument pdfDoc) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    stripper.setLineSeparator("\n");
    stripper.setParagraphEnd("\n");
    stripper.setSortByPosition(true);

    int pageCount = pdfDoc.getNumberOfPages();
    StringBuilder text = new StringBuilder();
    for (int page = 1; page <= pageCount; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      text.append(stripper.getText(pdfDoc).strip());
      text.append("\n\n-- ").append(page).append(" of ").append(pageCount).append(" --\n\n");
    }
    return text.toString();
  }
}
