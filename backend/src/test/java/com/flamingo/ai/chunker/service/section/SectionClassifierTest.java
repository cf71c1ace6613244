package com.flamingo.ai.chunker.service.section;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunker.service.conversion.MarkupBlockReader;
import com.flamingo.ai.chunker.service.conversion.TableMarkdownRenderer;
import com.flamingo.ai.chunker.service.model.Section;
import com.flamingo.ai.chunker.service.model.SectionResult;
import com.flamingo.ai.chunker.service.model.SectionStrategy;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SectionClassifier Tests")
class SectionClassifierTest {

  private static final String LETTERED_PROCEDURE =
      "<ol type=\"A\">"
          + "<li><strong>Purpose.</strong> This procedure defines change control.</li>"
          + "<li><strong>Scope.</strong> Applies to all production systems.</li>"
          + "<li><strong>Definitions.</strong> Change means any modification.</li>"
          + "<li><strong>Responsibilities.</strong> Owners approve changes.</li>"
          + "<li><strong>Procedure.</strong> Submit a request.</li>"
          + "<li><strong>References.</strong> See the quality manual.</li>"
          + "</ol>";

  private static final String NUMBERED_PROCEDURE =
      "<p>Intro before any heading.</p>"
          + "<h2>1.0 Purpose</h2><p>Why this exists.</p>"
          + "<h2>2.0 Scope</h2><p>Who it covers.</p>"
          + "<h2>3.0 Responsibilities</h2><p>Who does what.</p><p>More duties.</p>";

  private SectionClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier =
        new SectionClassifier(
            List.of(new NumberedHeadingStrategy(), new LetteredListStrategy()),
            new MarkupBlockReader(new TableMarkdownRenderer()));
  }

  @Nested
  @DisplayName("Lettered lists")
  class LetteredLists {

    @Test
    @DisplayName("should detect six bold-titled items with high confidence")
    void shouldDetectLetteredSections() {
      SectionResult result = classifier.classify(LETTERED_PROCEDURE);

      assertThat(result.strategy()).isEqualTo(SectionStrategy.LETTERED);
      assertThat(result.confidence()).isEqualTo(0.9);
      assertThat(result.sections())
          .extracting(s -> s.heading().marker())
          .containsExactly("A", "B", "C", "D", "E", "F");
      assertThat(result.sections())
          .extracting(Section::sectionTitle)
          .containsExactly(
              "Purpose", "Scope", "Definitions", "Responsibilities", "Procedure", "References");
      assertThat(result.sections().get(0).content())
          .isEqualTo("This procedure defines change control.");
      assertThat(result.preamble()).isEmpty();
    }

    @Test
    @DisplayName("should include blocks between items in the preceding section")
    void shouldIncludeInterveningBlocks() {
      String html =
          "<p>Preamble.</p>"
              + "<ol><li><strong>Purpose.</strong> Text.</li></ol>"
              + "<p>Extra paragraph.</p>"
              + "<table><tr><td>a</td></tr></table>"
              + "<ol><li><p><b>Scope</b> All staff.</p></li></ol>";

      SectionResult result = classifier.classify(html);

      assertThat(result.sections()).hasSize(2);
      assertThat(result.sections().get(0).content())
          .isEqualTo("Text.\n\nExtra paragraph.\n\n| a |\n| --- |");
      assertThat(result.sections().get(1).sectionTitle()).isEqualTo("Scope");
      assertThat(result.sections().get(1).content()).isEqualTo("All staff.");
      assertThat(result.preamble()).isEqualTo("Preamble.");
    }

    @Test
    @DisplayName("should lower confidence when few list items carry bold titles")
    void shouldLowerConfidence_whenRatioLow() {
      String html =
          "<ol><li><strong>Purpose.</strong> One.</li><li>plain</li>"
              + "<li><strong>Scope.</strong> Two.</li><li>plain again</li></ol>";

      SectionResult result = classifier.classify(html);

      assertThat(result.strategy()).isEqualTo(SectionStrategy.LETTERED);
      assertThat(result.sections()).hasSize(2);
      assertThat(result.confidence()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("should disqualify lettered detection when a bold title is numbered")
    void shouldDisqualify_whenBoldTitleNumbered() {
      String html =
          "<ol><li><strong>Purpose.</strong> One.</li>"
              + "<li><strong>2.0 Scope</strong> Two.</li></ol>";

      SectionResult result = classifier.classify(html);

      assertThat(result.strategy()).isEqualTo(SectionStrategy.FALLBACK);
      assertThat(result.sections()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Numbered headings")
  class NumberedHeadings {

    @Test
    @DisplayName("should detect numbered headings and keep the preamble")
    void shouldDetectNumberedSections() {
      SectionResult result = classifier.classify(NUMBERED_PROCEDURE);

      assertThat(result.strategy()).isEqualTo(SectionStrategy.NUMBERED);
      assertThat(result.confidence()).isEqualTo(0.7);
      assertThat(result.sections())
          .extracting(s -> s.heading().marker())
          .containsExactly("1.0", "2.0", "3.0");
      assertThat(result.sections().get(2).sectionTitle()).isEqualTo("Responsibilities");
      assertThat(result.sections().get(2).content()).isEqualTo("Who does what.\n\nMore duties.");
      assertThat(result.preamble()).isEqualTo("Intro before any heading.");
    }

    @Test
    @DisplayName("should use the heading level with the most numbered headings")
    void shouldUseDominantLevel() {
      String html =
          "<h1>1 Overview</h1>"
              + "<h2>1.1 Inputs</h2><p>a</p>"
              + "<h2>1.2 Outputs</h2><p>b</p>"
              + "<h2>1.3 Controls</h2><p>c</p>";

      SectionResult result = classifier.classify(html);

      assertThat(result.sections())
          .extracting(s -> s.heading().marker())
          .containsExactly("1.1", "1.2", "1.3");
      assertThat(result.preamble()).isEqualTo("1 Overview");
    }

    @Test
    @DisplayName("should prefer the shallower level on a tie")
    void shouldPreferShallowerLevel_onTie() {
      String html = "<h1>1. Intro</h1><h3>1.1 Detail</h3><h1>2. Body</h1><h3>2.1 Detail</h3>";

      SectionResult result = classifier.classify(html);

      assertThat(result.sections())
          .extracting(Section::sectionTitle)
          .containsExactly("Intro", "Body");
      assertThat(result.sections().get(0).content()).isEqualTo("1.1 Detail");
    }
  }

  @Test
  @DisplayName("should prefer lettered over numbered when confidences tie")
  void shouldPreferLettered_whenConfidenceTies() {
    String html =
        LETTERED_PROCEDURE
            + "<h2>1 One</h2><h2>2 Two</h2><h2>3 Three</h2><h2>4 Four</h2><h2>5 Five</h2>";

    SectionResult result = classifier.classify(html);

    assertThat(result.strategy()).isEqualTo(SectionStrategy.LETTERED);
    assertThat(result.confidence()).isEqualTo(0.9);
  }

  @Test
  @DisplayName("should fall back when no strategy finds structure")
  void shouldFallBack_whenNoStructure() {
    SectionResult result = classifier.classify("<p>Just prose.</p><p>More prose.</p>");

    assertThat(result).isEqualTo(SectionResult.fallback());
  }

  @Test
  @DisplayName("should fall back for blank markup")
  void shouldFallBack_whenBlank() {
    assertThat(classifier.classify("  ").strategy()).isEqualTo(SectionStrategy.FALLBACK);
  }

  @Test
  @DisplayName("should order results by confidence then strategy priority")
  void shouldOrderByConfidenceThenPriority() {
    SectionResult numbered = new SectionResult(SectionStrategy.NUMBERED, List.of(), 0.7, "");
    SectionResult lettered = new SectionResult(SectionStrategy.LETTERED, List.of(), 0.7, "");
    SectionResult weak = new SectionResult(SectionStrategy.LETTERED, List.of(), 0.3, "");

    List<SectionResult> sorted =
        List.of(weak, numbered, lettered).stream()
            .sorted(SectionClassifier.BY_CONFIDENCE_THEN_PRIORITY)
            .toList();

    assertThat(sorted).containsExactly(lettered, numbered, weak);
  }
}
