package com.flamingo.ai.docinsight.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the structure extraction and relevance pipeline. */
@Configuration
@ConfigurationProperties(prefix = "docinsight")
@Validated
@Getter
@Setter
public class DocInsightConfig {

  @Valid private Layout layout = new Layout();
  @Valid private Title title = new Title();
  @Valid private Heading heading = new Heading();
  @Valid private Relevance relevance = new Relevance();
  @Valid private Selection selection = new Selection();
  @Valid private Processing processing = new Processing();
  @Valid private Batch batch = new Batch();

  @Getter
  @Setter
  public static class Layout {
    /** Maximum vertical distance (pt) between runs that still share a baseline. */
    @Positive private float lineTolerance = 2.0f;

    /** Horizontal gap between runs, as a fraction of font size, that becomes a space. */
    @Positive private float wordGapRatio = 0.15f;
  }

  @Getter
  @Setter
  public static class Title {
    @Min(1) private int maxCandidates = 15;

    /** Fraction of the page height below which a line gets no position credit. */
    private double positionCutoff = 0.5;

    private double minScore = 0.5;
    private double sizeWeight = 0.4;
    private double positionWeight = 0.2;
    private double contentWeight = 0.2;
    private double styleWeight = 0.2;
    private int maxLength = 100;
  }

  @Getter
  @Setter
  public static class Heading {
    /** Fallback multipliers of the dominant body size, used with fewer than 3 pool sizes. */
    private double h1Ratio = 1.5;

    private double h2Ratio = 1.3;
    private double h3Ratio = 1.1;
    @Min(1) private int maxHeadingWords = 20;

    /** Headings below this confidence are demoted to body text. 0 disables the filter. */
    private double minConfidence = 0.0;

    private int maxHeadingsPerPage = 10;
    private int maxHeadings = 100;
  }

  @Getter
  @Setter
  public static class Relevance {
    @Min(0) private int minSectionWords = 12;
    private double keywordWeight = 0.3;
    private double sectionTypeWeight = 0.2;
    private double contentDepthWeight = 0.2;
    private double quantitativeWeight = 0.15;
    private double positionWeight = 0.15;

    /** Fraction of profile keywords that must match for a full keyword score. */
    @DecimalMin(value = "0.0", inclusive = false)
    private double keywordSaturation = 0.5;

    /** Quantitative indicators per 100 words that count as fully quantitative. */
    @Positive private double quantitativeSaturation = 10.0;

    /** Section count above which position importance is pulled toward the middle. */
    @Min(1) private int longDocumentSections = 20;
  }

  @Getter
  @Setter
  public static class Selection {
    @Min(1) private int topK = 5;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minScore = 0.25;
    @Min(1) private int maxPerDocument = 2;
    @Min(1) private int excerptMaxChars = 500;
  }

  @Getter
  @Setter
  public static class Processing {
    /** Run per-document extraction on the document processing executor. */
    private boolean parallel = true;
  }

  @Getter
  @Setter
  public static class Batch {
    private boolean enabled = false;
    private Mode mode = Mode.OUTLINE;
    private String inputDir = "input";
    private String outputDir = "output";
    @NotBlank private String outputFile = "analysis_output.json";

    public enum Mode {
      OUTLINE,
      ANALYSIS
    }
  }
}
