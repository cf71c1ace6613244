package com.flamingo.ai.chunker.service.chunking;

import com.flamingo.ai.chunker.config.ChunkingConfig;
import com.flamingo.ai.chunker.service.cleansing.TextCleanser;
import com.flamingo.ai.chunker.service.conversion.HtmlTextConverter;
import com.flamingo.ai.chunker.service.conversion.MarkupBlock;
import com.flamingo.ai.chunker.service.conversion.MarkupBlockReader;
import com.flamingo.ai.chunker.service.header.HeaderMetadataExtractor;
import com.flamingo.ai.chunker.service.model.Chunk;
import com.flamingo.ai.chunker.service.model.DecodedDocument;
import com.flamingo.ai.chunker.service.model.DocumentHeaderMetadata;
import com.flamingo.ai.chunker.service.model.SectionResult;
import com.flamingo.ai.chunker.service.model.SourceFormat;
import com.flamingo.ai.chunker.service.section.SectionClassifier;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} for Word documents.
 *
 * <p>Pipeline:
 *
 * <ol>
 *   <li>header table → {@link HeaderMetadataExtractor}
 *   <li>body markup → blocks, tables rendered as Markdown
 *   <li>blocks → {@link SectionClassifier} (when enabled)
 *   <li>confident sections → section-aware chunks; otherwise blocks → text → Word cleanser → flat
 *       chunks
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WordDocumentChunker implements DocumentChunker {

  private final HeaderMetadataExtractor metadataExtractor;
  private final MarkupBlockReader blockReader;
  private final SectionClassifier sectionClassifier;
  private final ChunkAssembler chunkAssembler;
  private final ChunkingConfig config;
  private final TextCleanser cleanser = TextCleanser.forWord();

  @Override
  public List<Chunk> chunkDocument(DecodedDocument document) {
    List<MarkupBlock> blocks =
        document.isBlank() ? List.of() : blockReader.read(Jsoup.parse(document.body()));
    if (blocks.isEmpty()) {
      log.info("Document {} has no body content; no chunks produced", document.fileName());
      return List.of();
    }
    DocumentHeaderMetadata metadata =
        metadataExtractor.extract(document.header(), document.fileName());

    SectionResult sections = classify(blocks, document.fileName());

    if (sections.sections().isEmpty()) {
      String text = cleanser.cleanse(HtmlTextConverter.joinBlocks(blocks));
      return chunkAssembler.flat(text, metadata);
    }
    return chunkAssembler.bySection(sections, cleanser, metadata);
  }

  @Override
  public SourceFormat format() {
    return SourceFormat.WORD;
  }

  private SectionResult classify(List<MarkupBlock> blocks, String fileName) {
    if (!config.getSections().isEnabled()) {
      return SectionResult.fallback();
    }
    SectionResult result = sectionClassifier.classify(blocks);
    double minConfidence = config.getSections().getMinConfidence();
    if (!result.sections().isEmpty() && result.confidence() < minConfidence) {
      log.warn(
          "Section structure of {} is unreliable ({} at confidence {}); chunking flat",
          fileName,
          result.strategy().getValue(),
          result.confidence());
      return SectionResult.fallback();
    }
    log.debug(
        "Classified {} as {} with {} sections",
        fileName,
        result.strategy().getValue(),
        result.sections().size());
    return result;
  }
}
