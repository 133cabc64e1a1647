package com.flamingo.ai.docinsight.service.structure;

import com.flamingo.ai.docinsight.service.structure.model.SectionType;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Classifies a section into a {@link SectionType} from its title, falling back to its body.
 *
 * <p>Keywords are word prefixes ({@code method} matches "methods" and "methodology"). A title hit
 * wins in declaration order; otherwise the type with the most body hits, if at least {@value
 * #MIN_BODY_HITS}.
 */
@Component
public class SectionTypeClassifier {

  private static final int MIN_BODY_HITS = 2;

  private static final Map<SectionType, List<String>> KEYWORDS = new EnumMap<>(SectionType.class);

  static {
    KEYWORDS.put(
        SectionType.METHODOLOGY,
        List.of(
            "method", "approach", "procedure", "protocol", "implementation", "workflow",
            "technique", "setup"));
    KEYWORDS.put(
        SectionType.RESULTS,
        List.of(
            "result", "finding", "evaluation", "experiment", "performance", "benchmark",
            "outcome"));
    KEYWORDS.put(
        SectionType.INTRODUCTION,
        List.of("introduc", "background", "overview", "abstract", "summary", "preface",
            "motivation"));
    KEYWORDS.put(
        SectionType.DISCUSSION,
        List.of("discussion", "conclu", "implication", "limitation", "analysis",
            "interpretation"));
    KEYWORDS.put(
        SectionType.FINANCIAL,
        List.of(
            "financ", "revenue", "budget", "cost", "pricing", "profit", "investment", "earning",
            "fiscal", "market", "sales", "income"));
    KEYWORDS.put(
        SectionType.CONCEPTUAL,
        List.of("concept", "principle", "theory", "theoret", "definition", "fundamental",
            "basic", "mechanism"));
  }

  public SectionType classify(String title, String body) {
    List<String> titleTokens = tokenize(title);
    for (Map.Entry<SectionType, List<String>> entry : KEYWORDS.entrySet()) {
      if (countHits(titleTokens, entry.getValue()) > 0) {
        return entry.getKey();
      }
    }

    List<String> bodyTokens = tokenize(body);
    SectionType best = SectionType.OTHER;
    int bestHits = MIN_BODY_HITS - 1;
    for (Map.Entry<SectionType, List<String>> entry : KEYWORDS.entrySet()) {
      int hits = countHits(bodyTokens, entry.getValue());
      if (hits > bestHits) {
        best = entry.getKey();
        bestHits = hits;
      }
    }
    return best;
  }

  private static int countHits(List<String> tokens, List<String> keywords) {
    int hits = 0;
    for (String token : tokens) {
      for (String keyword : keywords) {
        if (token.startsWith(keyword)) {
          hits++;
          break;
        }
      }
    }
    return hits;
  }

  private static List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}]+"))
        .filter(t -> !t.isEmpty())
        .toList();
  }
}
