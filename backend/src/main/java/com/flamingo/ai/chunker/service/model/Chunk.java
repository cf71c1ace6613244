package com.flamingo.ai.chunker.service.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A bounded slice of document text plus provenance metadata, the unit handed to embedding.
 *
 * <p>Section fields are only populated by section-aware chunking and are {@code null} otherwise.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Chunk {

  String id;
  String text;

  // Document-level metadata
  @Builder.Default String documentTitle = "";
  @Builder.Default String documentNumber = "";
  @Builder.Default String revision = "";
  @Builder.Default String effectiveDate = "";

  /** Zero-based position of this chunk within the document. */
  int chunkIndex;

  int wordCount;
  ContentType contentType;
  Instant createdAt;

  // Section-level metadata
  String sectionTitle;
  SectionStrategy headingType;
  String headingMarker;
  Integer totalChunksInSection;
}
