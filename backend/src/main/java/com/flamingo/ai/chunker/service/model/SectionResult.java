package com.flamingo.ai.chunker.service.model;

import java.util.List;

/**
 * Outcome of one section detection strategy, or the winner of a comparison.
 *
 * @param strategy strategy that produced the result
 * @param sections detected sections in document order
 * @param confidence score in {@code [0, 1]}
 * @param preamble body text preceding the first detected section; empty when there is none
 */
public record SectionResult(
    SectionStrategy strategy, List<Section> sections, double confidence, String preamble) {

  public SectionResult {
    sections = List.copyOf(sections);
    preamble = preamble == null ? "" : preamble;
  }

  /** Result signalling that no reliable section structure was found. */
  public static SectionResult fallback() {
    return new SectionResult(SectionStrategy.FALLBACK, List.of(), 0.0, "");
  }

  /** Zero-confidence result for a strategy that found nothing usable. */
  public static SectionResult none(SectionStrategy strategy) {
    return new SectionResult(strategy, List.of(), 0.0, "");
  }
}
