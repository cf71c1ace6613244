package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.service.cleansing.TextCleanser;
import com.flamingo.ai.chunker.service.model.Chunk;
import com.flamingo.ai.chunker.service.model.DocumentHeaderMetadata;
import com.flamingo.ai.chunker.service.model.Section;
import com.flamingo.ai.chunker.service.model.SectionResult;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns cleansed text, or classified sections, into an indexed chunk list.
 *
 * <p>Shared by every {@link DocumentChunker}. Chunk indices run 0..n-1 across the whole document
 * in both modes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkAssembler {

  private final TableAwareChunker tableAwareChunker;
  private final ChunkBuilder chunkBuilder;

  /**
   * Chunks the whole body without section metadata.
   *
   * @param cleansedText cleansed body text
   * @param metadata document metadata
   */
  public List<Chunk> flat(String cleansedText, DocumentHeaderMetadata metadata) {
    List<Chunk> chunks = new ArrayList<>();
    for (String content : tableAwareChunker.partition(cleansedText)) {
      chunks.add(chunkBuilder.build(content, chunks.size(), metadata));
    }
    return chunks;
  }

  /**
   * Chunks each section independently so overlap never crosses a section boundary.
   *
   * <p>Content preceding the first section is chunked first, without section metadata.
   *
   * @param sections a classified result with at least one section
   * @param cleanser cleanser applied to the preamble and to each section's content
   * @param metadata document metadata
   */
  public List<Chunk> bySection(
      SectionResult sections, TextCleanser cleanser, DocumentHeaderMetadata metadata) {
    List<Chunk> chunks = new ArrayList<>();
    for (String content : tableAwareChunker.partition(cleanser.cleanse(sections.preamble()))) {
      chunks.add(chunkBuilder.build(content, chunks.size(), metadata));
    }

    for (Section section : sections.sections()) {
      List<String> contents = tableAwareChunker.partition(cleanser.cleanse(section.content()));
      if (contents.isEmpty()) {
        log.debug("Section '{}' has no content", section.sectionTitle());
        continue;
      }
      for (String content : contents) {
        chunks.add(
            chunkBuilder.build(content, chunks.size(), metadata, section, contents.size()));
      }
    }
    return chunks;
  }
}
