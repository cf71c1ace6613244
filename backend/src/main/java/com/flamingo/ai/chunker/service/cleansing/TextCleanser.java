package com.flamingo.ai.chunker.service.cleansing;

import java.util.List;

/**
 * Applies an ordered list of {@link TextCleansingRule}s, each to the output of the previous one.
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
public final class TextCleanser {

  private final List<TextCleansingRule> rules;

  public TextCleanser(List<TextCleansingRule> rules) {
    this.rules = List.copyOf(rules);
  }

  /** Rules for text converted from Word markup. */
  public static TextCleanser forWord() {
    return new TextCleanser(
        List.of(CleansingRules.imagePayloads(), CleansingRules.signatureLines()));
  }

  /** Rules for text extracted from PDFs, which repeat the header and mark page breaks. */
  public static TextCleanser forPdf() {
    return new TextCleanser(
        List.of(
            CleansingRules.pageMarkers(),
            CleansingRules.metadataHeaders(),
            CleansingRules.imagePayloads(),
            CleansingRules.signatureLines(),
            CleansingRules.blankLineRuns()));
  }

  public String cleanse(String text) {
    if (text == null) {
      return "";
    }
    String result = text;
    for (TextCleansingRule rule : rules) {
      result = rule.apply(result);
    }
    return result;
  }
}
