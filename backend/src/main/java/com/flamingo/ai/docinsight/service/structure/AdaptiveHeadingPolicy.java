package com.flamingo.ai.docinsight.service.structure;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStats;
import com.flamingo.ai.docinsight.service.structure.model.HeadingThresholds;
import com.flamingo.ai.docinsight.service.structure.model.Line;
import com.flamingo.ai.docinsight.service.structure.model.PatternMatch;
import com.flamingo.ai.docinsight.service.structure.model.TextHeuristics;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Default {@link HeadingPolicy}: document-relative size thresholds plus numbering patterns.
 *
 * <p>Thresholds come from the distinct line sizes above the dominant body size, excluding the
 * title size. With three or more such sizes the three largest are H1, H2 and H3; otherwise fixed
 * multiples of the dominant size are used.
 */
@Component
@RequiredArgsConstructor
public class AdaptiveHeadingPolicy implements HeadingPolicy {

  private static final Pattern NUMBERED =
      Pattern.compile("^(\\d{1,2}(?:\\.\\d{1,2})*)(\\.?)\\s+\\p{Lu}");
  private static final Pattern SECTION =
      Pattern.compile("^section\\s+(\\d{1,2}(?:\\.\\d{1,2})*)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern CHAPTER =
      Pattern.compile("^(?:chapter|part)\\s+(?:\\d+|[ivxlc]+)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern APPENDIX =
      Pattern.compile("^appendix\\b", Pattern.CASE_INSENSITIVE);

  private static final int MAX_ALL_CAPS_WORDS = 8;
  private static final int MAX_BOLD_WORDS = 10;

  private final DocInsightConfig config;

  @Override
  public HeadingThresholds thresholds(DocumentStats stats, float titleSize) {
    float dominant = stats.dominantSize();
    List<Float> pool =
        stats.distinctSizesDescending().stream()
            .filter(size -> size > dominant)
            .filter(size -> Float.isNaN(titleSize) || Float.compare(size, titleSize) != 0)
            .toList();

    if (pool.size() >= 3) {
      return new HeadingThresholds(pool.get(0), pool.get(1), pool.get(2), dominant);
    }
    DocInsightConfig.Heading settings = config.getHeading();
    return new HeadingThresholds(
        (float) (dominant * settings.getH1Ratio()),
        (float) (dominant * settings.getH2Ratio()),
        (float) (dominant * settings.getH3Ratio()),
        dominant);
  }

  @Override
  public PatternMatch matchPattern(Line line) {
    String text = line.text();
    int words = TextHeuristics.wordCount(text);
    if (words == 0 || !TextHeuristics.hasLetter(text)) {
      return PatternMatch.none();
    }

    if (words <= maxHeadingWords() && !text.endsWith(".")) {
      Matcher numbered = NUMBERED.matcher(text);
      if (numbered.find()) {
        String numbering = numbered.group(1);
        boolean bare = numbered.group(2).isEmpty() && numbering.indexOf('.') < 0;
        return new PatternMatch(
            bare ? PatternMatch.Kind.BARE_NUMBERED : PatternMatch.Kind.NUMBERED,
            depthOf(numbering));
      }
      Matcher section = SECTION.matcher(text);
      if (section.find()) {
        return new PatternMatch(PatternMatch.Kind.NUMBERED, depthOf(section.group(1)));
      }
      if (CHAPTER.matcher(text).find()) {
        return new PatternMatch(PatternMatch.Kind.CHAPTER, 1);
      }
      if (APPENDIX.matcher(text).find()) {
        return new PatternMatch(PatternMatch.Kind.APPENDIX, 1);
      }
    }

    if (words >= 2 && words <= MAX_ALL_CAPS_WORDS && TextHeuristics.isAllCaps(text)) {
      return new PatternMatch(PatternMatch.Kind.ALL_CAPS, 0);
    }
    if (line.bold() && words <= MAX_BOLD_WORDS && !TextHeuristics.endsWithBodyPunctuation(text)) {
      return new PatternMatch(PatternMatch.Kind.BOLD_SHORT, 0);
    }
    return PatternMatch.none();
  }

  @Override
  public boolean eligibleForSizeRule(Line line) {
    String text = line.text();
    int words = TextHeuristics.wordCount(text);
    return text.length() >= 2
        && words >= 1
        && words <= maxHeadingWords()
        && TextHeuristics.hasLetter(text);
  }

  private int maxHeadingWords() {
    return config.getHeading().getMaxHeadingWords();
  }

  private static int depthOf(String numbering) {
    return numbering.split("\\.").length;
  }
}
