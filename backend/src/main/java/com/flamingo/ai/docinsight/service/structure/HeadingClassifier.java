package com.flamingo.ai.docinsight.service.structure;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.service.structure.model.DetectedTitle;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStats;
import com.flamingo.ai.docinsight.service.structure.model.HeadingCandidate;
import com.flamingo.ai.docinsight.service.structure.model.HeadingLevel;
import com.flamingo.ai.docinsight.service.structure.model.HeadingThresholds;
import com.flamingo.ai.docinsight.service.structure.model.Line;
import com.flamingo.ai.docinsight.service.structure.model.NormalizedDocument;
import com.flamingo.ai.docinsight.service.structure.model.PatternMatch;
import com.flamingo.ai.docinsight.service.structure.model.TextHeuristics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assigns every line of a document a level in {TITLE, H1, H2, H3, NONE}.
 *
 * <p>A line is a heading when it passes the size rule or a pattern rule of the injected {@link
 * HeadingPolicy}. Numbering depth ("2." vs "2.1" vs "2.1.3") decides the level whenever present,
 * otherwise the size thresholds do. Post-processing drops repeated headings on a page and caps the
 * heading count; dropped headings fall back to body text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeadingClassifier {

  private static final double SIZE_CONFIDENCE_WEIGHT = 0.6;
  private static final double PATTERN_CONFIDENCE_WEIGHT = 0.4;

  private final HeadingPolicy headingPolicy;
  private final DocInsightConfig config;

  public List<HeadingCandidate> classify(NormalizedDocument document, DetectedTitle title) {
    List<Line> lines = document.lines();
    DocumentStats stats = document.stats();
    if (lines.isEmpty() || stats.isEmpty() || stats.dominantSize() <= 0) {
      return List.of();
    }

    HeadingThresholds thresholds = headingPolicy.thresholds(stats, title.fontSize());
    log.debug(
        "Heading thresholds for {}: H1={} H2={} H3={} (dominant {})",
        document.documentId(),
        thresholds.h1(),
        thresholds.h2(),
        thresholds.h3(),
        thresholds.dominantSize());

    double minConfidence = config.getHeading().getMinConfidence();
    List<HeadingCandidate> classified = new ArrayList<>(lines.size());
    for (Line line : lines) {
      if (line == title.line()) {
        classified.add(new HeadingCandidate(line, HeadingLevel.TITLE, title.score()));
        continue;
      }
      if (title.isContinuation(line)) {
        // folded into the title, belongs to no section
        continue;
      }
      HeadingCandidate candidate = classifyLine(line, thresholds);
      if (candidate.isHeading() && candidate.confidence() < minConfidence) {
        candidate = candidate.withLevel(HeadingLevel.NONE);
      }
      classified.add(candidate);
    }

    dropRepeatedHeadings(classified);
    enforceCaps(classified);
    return List.copyOf(classified);
  }

  HeadingCandidate classifyLine(Line line, HeadingThresholds thresholds) {
    HeadingLevel sizeLevel =
        headingPolicy.eligibleForSizeRule(line)
            ? thresholds.levelFor(line.fontSize())
            : HeadingLevel.NONE;
    PatternMatch pattern = headingPolicy.matchPattern(line);
    if (pattern.kind() == PatternMatch.Kind.BARE_NUMBERED
        && sizeLevel == HeadingLevel.NONE
        && !line.bold()) {
      // a bare leading number needs size or weight behind it
      pattern = PatternMatch.none();
    }

    HeadingLevel level;
    if (pattern.isStructural()) {
      level = HeadingLevel.forDepth(pattern.depth());
    } else if (pattern.matched()) {
      level = sizeLevel != HeadingLevel.NONE ? sizeLevel : HeadingLevel.H3;
    } else {
      level = sizeLevel;
    }
    return new HeadingCandidate(line, level, confidence(line, thresholds, pattern));
  }

  private double confidence(Line line, HeadingThresholds thresholds, PatternMatch pattern) {
    float dominant = thresholds.dominantSize();
    double excess = dominant > 0 ? (line.fontSize() - dominant) / dominant : 0.0;
    double sizePart = Math.max(0.0, Math.min(1.0, excess));
    double patternPart = pattern.matched() ? 1.0 : 0.0;
    return SIZE_CONFIDENCE_WEIGHT * sizePart + PATTERN_CONFIDENCE_WEIGHT * patternPart;
  }

  private void dropRepeatedHeadings(List<HeadingCandidate> classified) {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < classified.size(); i++) {
      HeadingCandidate candidate = classified.get(i);
      if (!candidate.isHeading()) {
        continue;
      }
      String key =
          candidate.line().pageIndex()
              + "|"
              + TextHeuristics.collapseWhitespace(candidate.line().text()).toLowerCase(Locale.ROOT);
      if (!seen.add(key)) {
        classified.set(i, candidate.withLevel(HeadingLevel.NONE));
      }
    }
  }

  private void enforceCaps(List<HeadingCandidate> classified) {
    DocInsightConfig.Heading settings = config.getHeading();
    Comparator<Integer> byConfidence =
        Comparator.<Integer>comparingDouble(i -> classified.get(i).confidence())
            .reversed()
            .thenComparingInt(i -> i);

    Map<Integer, List<Integer>> headingsByPage =
        IntStream.range(0, classified.size())
            .filter(i -> classified.get(i).isHeading())
            .boxed()
            .collect(Collectors.groupingBy(i -> classified.get(i).line().pageIndex()));

    int demoted = 0;
    Map<Integer, Boolean> kept = new HashMap<>();
    for (List<Integer> pageHeadings : headingsByPage.values()) {
      List<Integer> ranked = pageHeadings.stream().sorted(byConfidence).toList();
      for (int r = 0; r < ranked.size(); r++) {
        kept.put(ranked.get(r), r < settings.getMaxHeadingsPerPage());
      }
    }
    List<Integer> survivors =
        kept.entrySet().stream()
            .filter(Map.Entry::getValue)
            .map(Map.Entry::getKey)
            .sorted(byConfidence)
            .toList();
    for (int r = settings.getMaxHeadings(); r < survivors.size(); r++) {
      kept.put(survivors.get(r), false);
    }

    for (Map.Entry<Integer, Boolean> entry : kept.entrySet()) {
      if (!entry.getValue()) {
        int index = entry.getKey();
        classified.set(index, classified.get(index).withLevel(HeadingLevel.NONE));
        demoted++;
      }
    }
    if (demoted > 0) {
      log.debug("Demoted {} headings over the per-page or document cap", demoted);
    }
  }
}
