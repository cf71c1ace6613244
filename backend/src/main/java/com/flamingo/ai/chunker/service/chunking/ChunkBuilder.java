package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.model.Chunk;
import com.flamingo.ai.chunker.service.model.ContentType;
import com.flamingo.ai.chunker.service.model.DocumentHeaderMetadata;
import com.flamingo.ai.chunker.service.model.Section;
import java.time.Instant;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** Assembles {@link Chunk} records from content slices and document metadata. */
@Service
public class ChunkBuilder {

  /**
   * Builds a chunk without section metadata.
   *
   * @param text chunk content
   * @param index zero-based position within the document
   * @param metadata document metadata; {@code null} fields become empty strings
   */
  public Chunk build(String text, int index, DocumentHeaderMetadata metadata) {
    return builder(text, index, metadata).build();
  }

  /**
   * Builds a chunk that belongs to a detected section.
   *
   * @param totalChunksInSection number of chunks the section was split into
   */
  public Chunk build(
      String text,
      int index,
      DocumentHeaderMetadata metadata,
      Section section,
      int totalChunksInSection) {
    return builder(text, index, metadata)
        .sectionTitle(section.sectionTitle())
        .headingType(section.heading().type())
        .headingMarker(section.heading().marker())
        .totalChunksInSection(totalChunksInSection)
        .build();
  }

  private Chunk.ChunkBuilder builder(String text, int index, DocumentHeaderMetadata metadata) {
    DocumentHeaderMetadata meta = metadata != null ? metadata : DocumentHeaderMetadata.empty();
    return Chunk.builder()
        .id(chunkId(meta.documentNumber(), index))
        .text(text)
        .documentTitle(meta.documentTitle())
        .documentNumber(meta.documentNumber())
        .revision(meta.revision())
        .effectiveDate(meta.effectiveDate())
        .chunkIndex(index)
        .wordCount(TableAwareChunker.countWords(text))
        .contentType(TableAwareChunker.isTable(text) ? ContentType.TABLE : ContentType.TEXT)
        .createdAt(Instant.now());
  }

  // Without a procedure number there is nothing stable to derive the id from
  private String chunkId(String documentNumber, int index) {
    if (documentNumber.isBlank()) {
      return UUID.randomUUID().toString();
    }
    return documentNumber + "_chunk_" + index;
  }
}
