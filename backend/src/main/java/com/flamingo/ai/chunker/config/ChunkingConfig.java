package com.flamingo.ai.chunker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for document segmentation and chunking. */
@Configuration
@ConfigurationProperties(prefix = "chunking")
@Validated
@Getter
@Setter
public class ChunkingConfig {

  /** Word count a chunk accumulates towards before it is closed. */
  @Min(value = 1, message = "Target words must be at least 1")
  private int targetWords = 400;

  /**
   * Multiplier on {@link #targetWords} giving the hard ceiling a chunk may reach when one more
   * paragraph is appended.
   */
  @DecimalMin(value = "1.0", message = "Overflow factor must be at least 1.0")
  private double overflowFactor = 1.2;

  /** Approximate number of trailing words repeated at the start of the next chunk. */
  @Min(value = 0, message = "Overlap words must not be negative")
  private int overlapWords = 50;

  @Valid private Sections sections = new Sections();
  @Valid private Header header = new Header();
  @Valid private Pdf pdf = new Pdf();

  /** Hard word ceiling derived from the target and the overflow factor. */
  public double maxWords() {
    return targetWords * overflowFactor;
  }

  @Getter
  @Setter
  public static class Sections {
    /** Whether Word markup is run through the section classifier before chunking. */
    private boolean enabled = true;

    /** Winning results below this confidence fall back to flat chunking. */
    @DecimalMin(value = "0.0", message = "Minimum confidence must be at least 0.0")
    @DecimalMax(value = "1.0", message = "Minimum confidence must be at most 1.0")
    private double minConfidence = 0.5;
  }

  @Getter
  @Setter
  public static class Header {
    /** Archive entry holding the header table of a Word document. */
    @NotBlank(message = "Header entry name is required")
    private String entryName = "word/header1.xml";
  }

  @Getter
  @Setter
  public static class Pdf {
    /** Leading lines of the first page searched for labelled header fields. */
    @Min(value = 1, message = "Header scan lines must be at least 1")
    private int headerScanLines = 15;
  }
}
