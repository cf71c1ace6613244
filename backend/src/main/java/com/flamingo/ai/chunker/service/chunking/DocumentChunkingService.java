package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.model.Chunk;
import com.flamingo.ai.chunker.service.model.ContentType;
import com.flamingo.ai.chunker.service.model.DecodedDocument;
import com.flamingo.ai.chunker.service.model.SourceFormat;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point of the chunking engine: decodes a document and splits it into chunks.
 *
 * <p>Each call is independent and holds no shared mutable state, so callers may chunk several
 * documents concurrently. Within one call chunk order is deterministic.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentChunkingService {

  private final DocumentChunkerRouter router;
  private final MeterRegistry meterRegistry;

  /**
   * Decodes and chunks a raw document.
   *
   * @param content raw document bytes
   * @param fileName original file name
   * @param mimeType declared MIME type; may be {@code null}
   * @return chunks ordered by index; empty for an empty document
   * @throws com.flamingo.ai.chunker.exception.UnsupportedDocumentTypeException if the document is
   *     neither Word nor PDF
   * @throws com.flamingo.ai.chunker.exception.MissingHeaderException if a Word document has no
   *     header
   * @throws com.flamingo.ai.chunker.exception.DocumentProcessingException if decoding fails
   */
  @Timed(value = "chunker.document", description = "Time to chunk a document")
  public List<Chunk> chunk(byte[] content, String fileName, String mimeType) {
    SourceFormat format = router.resolve(mimeType, fileName);
    if (content == null || content.length == 0) {
      log.info("Document {} is empty; no chunks produced", fileName);
      return List.of();
    }
    DecodedDocument decoded = router.decoderFor(format).decode(content, fileName);
    return chunk(decoded);
  }

  /**
   * Chunks an already decoded document.
   *
   * @param document decoded markup or text plus header structure
   * @return chunks ordered by index
   */
  public List<Chunk> chunk(DecodedDocument document) {
    List<Chunk> chunks = router.chunkerFor(document.format()).chunkDocument(document);

    long tables = chunks.stream().filter(c -> c.getContentType() == ContentType.TABLE).count();
    recordChunks(document.format(), ContentType.TABLE, tables);
    recordChunks(document.format(), ContentType.TEXT, chunks.size() - tables);

    log.info(
        "Document {} split into {} chunks ({} tables)", document.fileName(), chunks.size(), tables);
    return chunks;
  }

  private void recordChunks(SourceFormat format, ContentType type, long count) {
    if (count > 0) {
      String formatTag = format.name().toLowerCase(Locale.ROOT);
      meterRegistry
          .counter("chunker.chunks", "format", formatTag, "content_type", type.getValue())
          .increment(count);
    }
  }
}
