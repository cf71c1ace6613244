package com.flamingo.ai.chunker.service.section;

import com.flamingo.ai.chunker.service.conversion.MarkupBlock;
import com.flamingo.ai.chunker.service.model.SectionResult;
import com.flamingo.ai.chunker.service.model.SectionStrategy;
import java.util.List;

/**
 * One heuristic for detecting a document's section structure from its markup blocks.
 *
 * <p>Implementations are pure functions of their input: each run over the same blocks
 * independently, and {@link SectionClassifier} compares their results.
 */
public interface SectionDetectionStrategy {

  /** The strategy this detector reports in its results. */
  SectionStrategy strategy();

  /**
   * Detects sections.
   *
   * @param blocks body blocks in document order
   * @return the detected sections with a confidence in {@code [0, 1]}; confidence 0 when nothing
   *     usable was found
   */
  SectionResult detect(List<MarkupBlock> blocks);
}
