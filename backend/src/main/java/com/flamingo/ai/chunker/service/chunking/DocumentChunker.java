package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.model.Chunk;
import com.flamingo.ai.chunker.service.model.DecodedDocument;
import com.flamingo.ai.chunker.service.model.SourceFormat;
import java.util.List;

/**
 * Splits a {@link DecodedDocument} into chunks ready for embedding.
 *
 * <p>One implementation per source format; each does its own metadata extraction and cleansing
 * and shares {@link ChunkAssembler} for partitioning. Implementations must be stateless and safe
 * for concurrent use.
 */
public interface DocumentChunker {

  /**
   * Produces chunks from the decoded document.
   *
   * @param document decoded markup or text plus header structure
   * @return chunks ordered by {@link Chunk#getChunkIndex()}; empty for a blank document
   * @throws com.flamingo.ai.chunker.exception.MissingHeaderException if the format requires a
   *     header and the document has none
   */
  List<Chunk> chunkDocument(DecodedDocument document);

  /** The source format this chunker handles. */
  SourceFormat format();
}
