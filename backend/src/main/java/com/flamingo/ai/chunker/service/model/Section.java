package com.flamingo.ai.chunker.service.model;

/**
 * One inferred structural unit of a document body.
 *
 * @param sectionTitle title text following the marker, e.g. {@code "Purpose"}
 * @param content body text of the section, blocks separated by blank lines
 * @param heading how the section was detected
 */
public record Section(String sectionTitle, String content, Heading heading) {

  /**
   * @param type strategy that produced the section
   * @param marker detected label such as {@code "A"} or {@code "2.0"}; may be {@code null}
   */
  public record Heading(SectionStrategy type, String marker) {}
}
