package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.cleansing.TextCleanser;
import com.flamingo.ai.chunker.service.header.PdfHeaderMetadataExtractor;
import com.flamingo.ai.chunker.service.model.Chunk;
import com.flamingo.ai.chunker.service.model.DecodedDocument;
import com.flamingo.ai.chunker.service.model.DocumentHeaderMetadata;
import com.flamingo.ai.chunker.service.model.SourceFormat;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} for PDF documents.
 *
 * <p>Metadata is read from the labelled lines at the top of the first page before cleansing
 * removes the repeated header, page markers and signature blanks. The cleansed text is chunked
 * flat; PDFs carry no markup to classify sections from.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfDocumentChunker implements DocumentChunker {

  private final PdfHeaderMetadataExtractor metadataExtractor;
  private final ChunkAssembler chunkAssembler;
  private final TextCleanser cleanser = TextCleanser.forPdf();

  @Override
  public List<Chunk> chunkDocument(DecodedDocument document) {
    if (document.isBlank()) {
      log.info("Document {} has no extractable text; no chunks produced", document.fileName());
      return List.of();
    }
    DocumentHeaderMetadata metadata = metadataExtractor.extract(document.body());
    return chunkAssembler.flat(cleanser.cleanse(document.body()), metadata);
  }

  @Override
  public SourceFormat format() {
    return SourceFormat.PDF;
  }
}
