package com.flamingo.ai.docinsight.service.structure.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Font-size distribution of one document, computed once by the layout normalizer.
 *
 * @param sizeCounts number of lines per font size
 * @param dominantSize most frequent line size, ties broken towards the larger size; 0 when empty
 * @param distinctSizesDescending every distinct line size, largest first
 * @param linesPerPage number of lines per page index
 * @param pageHeights page height per page index
 */
public record DocumentStats(
    Map<Float, Integer> sizeCounts,
    float dominantSize,
    List<Float> distinctSizesDescending,
    Map<Integer, Integer> linesPerPage,
    Map<Integer, Float> pageHeights) {

  private static final float DEFAULT_PAGE_HEIGHT = 792f;

  public static DocumentStats of(List<Line> lines, Map<Integer, Float> pageHeights) {
    Map<Float, Integer> sizeCounts = new TreeMap<>();
    Map<Integer, Integer> linesPerPage = new TreeMap<>();
    for (Line line : lines) {
      sizeCounts.merge(line.fontSize(), 1, Integer::sum);
      linesPerPage.merge(line.pageIndex(), 1, Integer::sum);
    }
    float dominant =
        sizeCounts.entrySet().stream()
            .max(
                Map.Entry.<Float, Integer>comparingByValue()
                    .thenComparing(Map.Entry.<Float, Integer>comparingByKey()))
            .map(Map.Entry::getKey)
            .orElse(0f);
    List<Float> distinct =
        sizeCounts.keySet().stream().sorted(Comparator.reverseOrder()).toList();
    return new DocumentStats(
        Collections.unmodifiableMap(sizeCounts),
        dominant,
        distinct,
        Collections.unmodifiableMap(linesPerPage),
        Map.copyOf(pageHeights));
  }

  public static DocumentStats empty() {
    return new DocumentStats(Map.of(), 0f, List.of(), Map.of(), Map.of());
  }

  public boolean isEmpty() {
    return sizeCounts.isEmpty();
  }

  public float pageHeight(int pageIndex) {
    Float height = pageHeights.get(pageIndex);
    return height != null && height > 0 ? height : DEFAULT_PAGE_HEIGHT;
  }
}
