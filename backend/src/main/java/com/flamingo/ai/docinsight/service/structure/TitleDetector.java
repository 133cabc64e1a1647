package com.flamingo.ai.docinsight.service.structure;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.service.structure.model.DetectedTitle;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStats;
import com.flamingo.ai.docinsight.service.structure.model.Line;
import com.flamingo.ai.docinsight.service.structure.model.NormalizedDocument;
import com.flamingo.ai.docinsight.service.structure.model.TextHeuristics;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the document title among the first lines of page 0.
 *
 * <p>Each candidate gets four sub-scores in [0, 1] (size relative to the largest page-0 line,
 * vertical position, text quality, style) combined with the configured weights. The best candidate
 * at or above {@code docinsight.title.min-score} wins; otherwise the title is empty. A title that
 * wraps onto up to two more lines of the same size and weight is joined into one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TitleDetector {

  private static final Pattern NOT_A_TITLE =
      Pattern.compile(
          "^(?:\\d+(?:\\.\\d+)*\\.?\\s|page\\b|figure\\b|fig\\.)", Pattern.CASE_INSENSITIVE);

  private static final int MAX_CONTINUATION_LINES = 2;
  private static final float SIZE_TOLERANCE = 0.5f;
  private static final float LINE_SPACING_FACTOR = 2.0f;

  private final DocInsightConfig config;

  public DetectedTitle detect(NormalizedDocument document) {
    DocInsightConfig.Title settings = config.getTitle();
    List<Line> firstPage =
        document.lines().stream()
            .filter(l -> l.pageIndex() == 0)
            .limit(settings.getMaxCandidates())
            .toList();
    if (firstPage.isEmpty()) {
      return DetectedTitle.none();
    }

    DocumentStats stats = document.stats();
    float maxSize = (float) firstPage.stream().mapToDouble(Line::fontSize).max().orElse(0.0);
    float pageHeight = stats.pageHeight(0);

    Line best = null;
    double bestScore = -1.0;
    for (Line line : firstPage) {
      if (!isCandidate(line, stats)) {
        continue;
      }
      double score = score(line, maxSize, pageHeight);
      if (score > bestScore) {
        best = line;
        bestScore = score;
      }
    }

    if (best == null || bestScore < settings.getMinScore()) {
      log.debug(
          "No title candidate of {} cleared {}", document.documentId(), settings.getMinScore());
      return DetectedTitle.none();
    }
    List<Line> continuation = continuation(document.lines(), best);
    StringBuilder text = new StringBuilder(best.text());
    continuation.forEach(l -> text.append(' ').append(l.text()));
    return new DetectedTitle(clean(text.toString()), best, continuation, bestScore);
  }

  /** Page-0 lines right below the title in the same size and weight, wrapping its text. */
  List<Line> continuation(List<Line> lines, Line title) {
    int index = lines.indexOf(title);
    if (index < 0) {
      return List.of();
    }
    List<Line> wrapped = new ArrayList<>();
    Line previous = title;
    for (int i = index + 1; i < lines.size() && wrapped.size() < MAX_CONTINUATION_LINES; i++) {
      Line next = lines.get(i);
      boolean sameStyle =
          next.pageIndex() == 0
              && Math.abs(next.fontSize() - title.fontSize()) < SIZE_TOLERANCE
              && next.bold() == title.bold();
      boolean adjacent = next.y0() - previous.y0() <= LINE_SPACING_FACTOR * title.fontSize();
      if (!sameStyle
          || !adjacent
          || !TextHeuristics.hasLetter(next.text())
          || NOT_A_TITLE.matcher(next.text()).find()) {
        break;
      }
      wrapped.add(next);
      previous = next;
    }
    return wrapped;
  }

  double score(Line line, float maxSize, float pageHeight) {
    DocInsightConfig.Title settings = config.getTitle();
    double total =
        settings.getSizeWeight() * sizeScore(line, maxSize)
            + settings.getPositionWeight() * positionScore(line, pageHeight)
            + settings.getContentWeight() * contentScore(line.text())
            + settings.getStyleWeight() * styleScore(line);
    return clamp(total);
  }

  double sizeScore(Line line, float maxSize) {
    return maxSize > 0 ? clamp(line.fontSize() / maxSize) : 0.0;
  }

  double positionScore(Line line, float pageHeight) {
    double cutoff = config.getTitle().getPositionCutoff();
    if (pageHeight <= 0 || cutoff <= 0) {
      return 0.0;
    }
    double relative = Math.max(0.0, line.y0()) / pageHeight;
    return clamp(1.0 - relative / cutoff);
  }

  double contentScore(String text) {
    int words = TextHeuristics.wordCount(text);
    double score = 0.5;
    if (words < 3) {
      score -= 0.3;
    } else if (words > 25) {
      score -= 0.4;
    } else {
      score += 0.3;
    }
    if (TextHeuristics.isAllCaps(text)) {
      score -= 0.2;
    } else if (TextHeuristics.isTitleOrSentenceCase(text)) {
      score += 0.2;
    }
    if (TextHeuristics.endsWithBodyPunctuation(text)) {
      score -= 0.2;
    }
    return clamp(score);
  }

  double styleScore(Line line) {
    if (line.bold()) {
      return 1.0;
    }
    return line.italic() ? 0.5 : 0.0;
  }

  private boolean isCandidate(Line line, DocumentStats stats) {
    String text = line.text();
    if (text.length() < 3 || !TextHeuristics.hasLetter(text)) {
      return false;
    }
    if (NOT_A_TITLE.matcher(text).find()) {
      return false;
    }
    return line.fontSize() > stats.dominantSize() || line.bold();
  }

  private String clean(String title) {
    String cleaned = TextHeuristics.collapseWhitespace(title);
    int maxLength = config.getTitle().getMaxLength();
    if (cleaned.length() > maxLength) {
      String cut = cleaned.substring(0, maxLength);
      int lastSpace = cut.lastIndexOf(' ');
      cleaned = lastSpace > 0 ? cut.substring(0, lastSpace) : cut;
    }
    return cleaned;
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
