package com.flamingo.ai.docinsight.service.structure;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.service.extraction.model.PageRuns;
import com.flamingo.ai.docinsight.service.extraction.model.RawDocument;
import com.flamingo.ai.docinsight.service.extraction.model.TextRun;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStats;
import com.flamingo.ai.docinsight.service.structure.model.Line;
import com.flamingo.ai.docinsight.service.structure.model.NormalizedDocument;
import com.flamingo.ai.docinsight.service.structure.model.TextHeuristics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Groups raw text runs into lines and computes the document's font-size statistics.
 *
 * <p>Runs whose top edge lies within {@code docinsight.layout.line-tolerance} of a line's first
 * run join that line. Lines are ordered by page, then top to bottom; runs within a line by x0.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LayoutNormalizer {

  private static final Comparator<TextRun> TOP_TO_BOTTOM =
      Comparator.<TextRun>comparingDouble(r -> r.bbox().y0())
          .thenComparingDouble(r -> r.bbox().x0());

  private static final Comparator<TextRun> LEFT_TO_RIGHT =
      Comparator.comparingDouble(r -> r.bbox().x0());

  private final DocInsightConfig config;

  public NormalizedDocument normalize(RawDocument document) {
    if (document == null || document.pages() == null || document.pages().isEmpty()) {
      return NormalizedDocument.empty(document != null ? document.documentId() : null);
    }

    List<PageRuns> pages = new ArrayList<>(document.pages());
    pages.sort(Comparator.comparingInt(PageRuns::pageIndex));

    List<Line> lines = new ArrayList<>();
    Map<Integer, Float> pageHeights = new TreeMap<>();
    for (PageRuns page : pages) {
      List<TextRun> runs =
          page.runs() == null
              ? List.of()
              : page.runs().stream()
                  .filter(r -> r.text() != null && !r.text().isBlank() && r.bbox() != null)
                  .sorted(TOP_TO_BOTTOM)
                  .toList();
      pageHeights.put(page.pageIndex(), resolvePageHeight(page, runs));
      lines.addAll(groupIntoLines(page.pageIndex(), runs));
    }

    DocumentStats stats = DocumentStats.of(lines, pageHeights);
    log.debug(
        "Normalized {}: {} lines on {} pages, dominant size {}",
        document.documentId(),
        lines.size(),
        pages.size(),
        stats.dominantSize());
    return new NormalizedDocument(document.documentId(), List.copyOf(lines), stats);
  }

  private float resolvePageHeight(PageRuns page, List<TextRun> runs) {
    if (page.pageHeight() > 0) {
      return page.pageHeight();
    }
    return (float) runs.stream().mapToDouble(r -> r.bbox().y1()).max().orElse(0.0);
  }

  private List<Line> groupIntoLines(int pageIndex, List<TextRun> runs) {
    float tolerance = config.getLayout().getLineTolerance();
    List<Line> lines = new ArrayList<>();
    List<TextRun> current = new ArrayList<>();
    float anchorY = Float.NaN;

    for (TextRun run : runs) {
      if (!current.isEmpty() && Math.abs(run.bbox().y0() - anchorY) > tolerance) {
        addLine(lines, pageIndex, current);
        current = new ArrayList<>();
      }
      if (current.isEmpty()) {
        anchorY = run.bbox().y0();
      }
      current.add(run);
    }
    addLine(lines, pageIndex, current);
    return lines;
  }

  private void addLine(List<Line> lines, int pageIndex, List<TextRun> runs) {
    if (runs.isEmpty()) {
      return;
    }
    List<TextRun> ordered = new ArrayList<>(runs);
    ordered.sort(LEFT_TO_RIGHT);

    String text = joinRuns(ordered);
    if (text.isEmpty()) {
      return;
    }

    // Size carrying the most characters; ties go to the larger size
    Map<Float, Integer> charsBySize = new HashMap<>();
    Map<Float, String> fontBySize = new HashMap<>();
    for (TextRun run : ordered) {
      float size = roundSize(run.fontSize());
      charsBySize.merge(size, run.text().strip().length(), Integer::sum);
      fontBySize.putIfAbsent(size, run.fontName());
    }
    float dominant =
        charsBySize.entrySet().stream()
            .max(
                Map.Entry.<Float, Integer>comparingByValue()
                    .thenComparing(Map.Entry.<Float, Integer>comparingByKey()))
            .map(Map.Entry::getKey)
            .orElse(0f);

    long boldRuns = ordered.stream().filter(TextRun::bold).count();
    long italicRuns = ordered.stream().filter(TextRun::italic).count();
    float top = (float) ordered.stream().mapToDouble(r -> r.bbox().y0()).min().orElse(0.0);

    lines.add(
        new Line(
            text,
            dominant,
            fontBySize.get(dominant),
            boldRuns * 2 > ordered.size(),
            italicRuns * 2 > ordered.size(),
            pageIndex,
            ordered.get(0).bbox().x0(),
            top,
            List.copyOf(ordered)));
  }

  private String joinRuns(List<TextRun> ordered) {
    float gapRatio = config.getLayout().getWordGapRatio();
    StringBuilder text = new StringBuilder();
    TextRun previous = null;
    for (TextRun run : ordered) {
      if (previous != null) {
        float gap = run.bbox().x0() - previous.bbox().x1();
        if (gap > gapRatio * Math.max(previous.fontSize(), 1f)) {
          text.append(' ');
        }
      }
      text.append(run.text());
      previous = run;
    }
    return TextHeuristics.collapseWhitespace(text.toString());
  }

  private static float roundSize(float size) {
    return Math.round(size * 10f) / 10f;
  }
}
