package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.exception.UnsupportedDocumentTypeException;
import com.flamingo.ai.chunker.service.conversion.DocumentDecoder;
import com.flamingo.ai.chunker.service.model.SourceFormat;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Routes a document to the decoder and chunker for its source format.
 *
 * <p>{@link DocumentChunkingService} depends exclusively on this router; it never references
 * concrete decoder or chunker implementations.
 */
@Service
@RequiredArgsConstructor
public class DocumentChunkerRouter {

  private final List<DocumentDecoder> decoders;
  private final List<DocumentChunker> chunkers;

  /**
   * Resolves the source format of a document.
   *
   * @param mimeType declared MIME type; may be {@code null}
   * @param fileName original file name, used when the MIME type is missing or generic
   * @throws UnsupportedDocumentTypeException if the document is neither Word nor PDF
   */
  public SourceFormat resolve(String mimeType, String fileName) {
    return SourceFormat.resolve(mimeType, fileName)
        .orElseThrow(() -> new UnsupportedDocumentTypeException(mimeType));
  }

  public DocumentDecoder decoderFor(SourceFormat format) {
    return decoders.stream()
        .filter(decoder -> decoder.format() == format)
        .findFirst()
        .orElseThrow(() -> new UnsupportedDocumentTypeException(format.name()));
  }

  public DocumentChunker chunkerFor(SourceFormat format) {
    return chunkers.stream()
        .filter(chunker -> chunker.format() == format)
        .findFirst()
        .orElseThrow(() -> new UnsupportedDocumentTypeException(format.name()));
  }
}
