package com.flamingo.ai.chunker.service.conversion;

import com.flamingo.ai.chunker.service.model.DecodedDocument;
import com.flamingo.ai.chunker.service.model.SourceFormat;

/**
 * Decodes a binary document container into markup or text plus its header structure.
 *
 * <p>Implementations are format-specific and must be deterministic for identical input bytes.
 * They must be stateless so a single instance can serve concurrent requests.
 */
public interface DocumentDecoder {

  /**
   * Decodes the given document.
   *
   * @param content raw document bytes
   * @param fileName original file name
   * @return the decoded document
   * @throws com.flamingo.ai.chunker.exception.DocumentProcessingException if the container
   *     cannot be read
   */
  DecodedDocument decode(byte[] content, String fileName);

  /** The container format this decoder reads. */
  SourceFormat format();
}
