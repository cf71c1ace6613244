package com.flamingo.ai.chunker.service.section;

import com.flamingo.ai.chunker.service.conversion.MarkupBlock;
import com.flamingo.ai.chunker.service.conversion.MarkupBlockReader;
import com.flamingo.ai.chunker.service.model.SectionResult;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

/**
 * Classifies a document's section structure by running every {@link SectionDetectionStrategy}
 * over the same markup and keeping the most confident result.
 *
 * <p>Results are ordered by confidence, highest first, then by the declaration order of {@link
 * com.flamingo.ai.chunker.service.model.SectionStrategy} (lettered before numbered). When no
 * strategy reports a confidence above zero the {@link SectionResult#fallback()} result is returned
 * and callers chunk the whole body flat.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SectionClassifier {

  static final Comparator<SectionResult> BY_CONFIDENCE_THEN_PRIORITY =
      Comparator.comparingDouble(SectionResult::confidence)
          .reversed()
          .thenComparing(result -> result.strategy().ordinal());

  private final List<SectionDetectionStrategy> strategies;
  private final MarkupBlockReader blockReader;

  public SectionResult classify(String html) {
    if (html == null || html.isBlank()) {
      return SectionResult.fallback();
    }
    return classify(Jsoup.parse(html));
  }

  public SectionResult classify(Document markup) {
    return classify(blockReader.read(markup));
  }

  public SectionResult classify(List<MarkupBlock> blocks) {
    List<SectionResult> results =
        strategies.stream().map(strategy -> strategy.detect(blocks)).toList();
    for (SectionResult result : results) {
      log.debug(
          "Strategy {} found {} sections (confidence {})",
          result.strategy().getValue(),
          result.sections().size(),
          result.confidence());
    }

    return results.stream()
        .min(BY_CONFIDENCE_THEN_PRIORITY)
        .filter(best -> best.confidence() > 0)
        .orElseGet(SectionResult::fallback);
  }
}
