package com.flamingo.ai.docinsight.service.relevance;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.service.relevance.model.RankedSection;
import com.flamingo.ai.docinsight.service.relevance.model.ScoredSection;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Picks the top sections of a collection while spreading them across documents.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Drop sections below the minimum score and sort by score, then document, page, section
 *   <li>Take the best section from a document not yet represented
 *   <li>Otherwise take the best section from a document below the per-document ceiling
 *   <li>Otherwise, only when fewer documents qualify than slots, take the best remaining section
 *   <li>Re-sort the picks and rank them 1..K
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiversityAwareSelector {

  static final Comparator<ScoredSection> BY_RELEVANCE =
      Comparator.comparingDouble(ScoredSection::score)
          .reversed()
          .thenComparingInt(ScoredSection::documentOrder)
          .thenComparingInt(ScoredSection::page)
          .thenComparingInt(s -> s.section().index());

  private final DocInsightConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Selects and ranks sections.
   *
   * @param candidates scored sections in any order
   * @return at most {@code top-k} sections ranked densely from 1, without refined text
   */
  public List<RankedSection> select(List<ScoredSection> candidates) {
    if (candidates == null || candidates.isEmpty()) {
      return List.of();
    }

    DocInsightConfig.Selection selection = config.getSelection();
    int topK = selection.getTopK();
    int maxPerDocument = selection.getMaxPerDocument();

    List<ScoredSection> remaining =
        candidates.stream()
            .filter(s -> s.score() >= selection.getMinScore())
            .sorted(BY_RELEVANCE)
            .collect(Collectors.toCollection(ArrayList::new));

    long qualifyingDocuments =
        remaining.stream().map(ScoredSection::documentId).distinct().count();
    boolean relaxCeiling = qualifyingDocuments < topK;

    Map<String, Integer> taken = new HashMap<>();
    List<ScoredSection> picked = new ArrayList<>();

    while (picked.size() < topK && !remaining.isEmpty()) {
      ScoredSection next = takeFirst(remaining, s -> !taken.containsKey(s.documentId()));
      if (next == null) {
        next = takeFirst(remaining, s -> taken.get(s.documentId()) < maxPerDocument);
      }
      if (next == null && relaxCeiling) {
        next = remaining.remove(0);
      }
      if (next == null) {
        break;
      }
      picked.add(next);
      taken.merge(next.documentId(), 1, Integer::sum);
    }

    picked.sort(BY_RELEVANCE);
    List<RankedSection> ranked = new ArrayList<>(picked.size());
    for (int i = 0; i < picked.size(); i++) {
      ranked.add(new RankedSection(i + 1, picked.get(i), ""));
    }

    meterRegistry.counter("docinsight.sections.selected").increment(ranked.size());
    log.debug(
        "Selected {} of {} sections from {} documents (diversity score: {})",
        ranked.size(),
        candidates.size(),
        taken.size(),
        String.format("%.2f", calculateDiversityScore(picked)));
    return ranked;
  }

  /**
   * Calculates a diversity score for a set of sections.
   *
   * @param sections the sections to evaluate
   * @return diversity score between 0.0 (all from one document) and 1.0 (one per document)
   */
  public double calculateDiversityScore(List<ScoredSection> sections) {
    if (sections == null || sections.isEmpty()) {
      return 0.0;
    }
    long uniqueDocuments = sections.stream().map(ScoredSection::documentId).distinct().count();
    return (double) uniqueDocuments / sections.size();
  }

  private static ScoredSection takeFirst(
      List<ScoredSection> sorted, Predicate<ScoredSection> eligible) {
    Iterator<ScoredSection> it = sorted.iterator();
    while (it.hasNext()) {
      ScoredSection candidate = it.next();
      if (eligible.test(candidate)) {
        it.remove();
        return candidate;
      }
    }
    return null;
  }
}
