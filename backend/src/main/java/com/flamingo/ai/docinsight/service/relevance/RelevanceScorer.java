package com.flamingo.ai.docinsight.service.relevance;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import com.flamingo.ai.docinsight.service.persona.ContentPreferences;
import com.flamingo.ai.docinsight.service.persona.PersonaPreferenceTable;
import com.flamingo.ai.docinsight.service.persona.PersonaProfile;
import com.flamingo.ai.docinsight.service.relevance.model.ScoreBreakdown;
import com.flamingo.ai.docinsight.service.relevance.model.ScoredSection;
import com.flamingo.ai.docinsight.service.structure.model.DocumentStructure;
import com.flamingo.ai.docinsight.service.structure.model.Section;
import com.flamingo.ai.docinsight.service.structure.model.SectionType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores every section of a document collection against a persona profile.
 *
 * <p>Composite score is a weighted sum of five factors in [0, 1]:
 *
 * <ul>
 *   <li>keyword match: profile keywords found as word prefixes in title and body
 *   <li>section type: persona affinity for the section's content type
 *   <li>content depth: closeness of sentence length and technical density to the persona target
 *   <li>quantitative content: closeness of numeric density to the persona target
 *   <li>position importance: earlier sections within a document score higher
 * </ul>
 *
 * <p>Scoring is a pure function of its inputs, so results are reproducible across runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelevanceScorer {

  private static final double SHORT_SENTENCE_WORDS = 8.0;
  private static final double LONG_SENTENCE_WORDS = 25.0;
  private static final double TECHNICAL_DENSITY_SATURATION = 0.15;
  private static final int LONG_WORD_LENGTH = 10;

  private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]+(?:\\s+|$)");
  private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}%.,-]+");
  private static final Pattern NUMERIC = Pattern.compile(".*\\d.*");

  static final Set<String> TECHNICAL_TERMS =
      Set.of(
          "algorithm", "architecture", "parameter", "parameters", "model", "models",
          "framework", "hypothesis", "dataset", "datasets", "methodology", "protocol",
          "implementation", "optimization", "coefficient", "regression", "validation",
          "analysis", "experiment", "experimental", "simulation", "specification", "variable",
          "variables", "function", "matrix", "kinetics", "synthesis", "mechanism", "theorem");

  static final Set<String> STATISTICAL_TERMS =
      Set.of(
          "percent", "percentage", "average", "mean", "median", "ratio", "rate", "growth",
          "increase", "decrease", "total", "correlation", "variance", "deviation", "significant",
          "statistic", "statistics", "statistical", "million", "billion", "margin", "quarter");

  private final DocInsightConfig config;
  private final PersonaPreferenceTable preferenceTable;

  /**
   * Scores all eligible sections in collection order.
   *
   * @param documents document structures in input order
   * @param profile persona profile
   * @return scored sections; sections below the minimum word count are omitted
   */
  public List<ScoredSection> score(List<DocumentStructure> documents, PersonaProfile profile) {
    DocInsightConfig.Relevance relevance = config.getRelevance();
    List<ScoredSection> scored = new ArrayList<>();
    List<String> keywords = List.copyOf(profile.allKeywords());

    for (int docOrder = 0; docOrder < documents.size(); docOrder++) {
      DocumentStructure document = documents.get(docOrder);
      List<Section> sections = document.sections();
      String documentTitle = document.title().isPresent() ? document.title().text() : "";
      for (Section section : sections) {
        if (section.wordCount() < relevance.getMinSectionWords()) {
          continue;
        }
        ScoreBreakdown breakdown = breakdown(section, sections.size(), keywords, profile);
        scored.add(
            new ScoredSection(
                document.documentId(),
                docOrder,
                documentTitle,
                section,
                composite(breakdown),
                breakdown));
      }
    }

    log.debug(
        "Scored {} sections across {} documents for persona {}",
        scored.size(),
        documents.size(),
        profile.type().tag());
    return scored;
  }

  ScoreBreakdown breakdown(
      Section section, int totalSections, List<String> keywords, PersonaProfile profile) {
    String text = section.title() + "\n" + section.rawText();
    List<String> words = words(text);
    ContentPreferences prefs = profile.preferences();

    return new ScoreBreakdown(
        keywordMatch(words, keywords),
        sectionTypeScore(section.type(), profile),
        1.0 - Math.abs(measuredDepth(section.rawText(), words) - prefs.technicalDepth()),
        1.0 - Math.abs(measuredQuantitative(words) - prefs.quantitativeFocus()),
        positionImportance(section.index(), totalSections));
  }

  double composite(ScoreBreakdown b) {
    DocInsightConfig.Relevance r = config.getRelevance();
    double score =
        r.getKeywordWeight() * b.keywordMatch()
            + r.getSectionTypeWeight() * b.sectionType()
            + r.getContentDepthWeight() * b.contentDepth()
            + r.getQuantitativeWeight() * b.quantitativeContent()
            + r.getPositionWeight() * b.positionImportance();
    return clamp(score);
  }

  double keywordMatch(List<String> words, List<String> keywords) {
    if (keywords.isEmpty()) {
      return 0.0;
    }
    int matched = 0;
    for (String keyword : keywords) {
      for (String word : words) {
        if (word.startsWith(keyword)) {
          matched++;
          break;
        }
      }
    }
    double saturation = keywords.size() * config.getRelevance().getKeywordSaturation();
    return clamp(matched / saturation);
  }

  double sectionTypeScore(SectionType type, PersonaProfile profile) {
    double affinity = preferenceTable.affinity(profile.type(), type);
    if (type == SectionType.INTRODUCTION || type == SectionType.CONCEPTUAL) {
      return (affinity + profile.preferences().introductoryFocus()) / 2.0;
    }
    return affinity;
  }

  /** Mean of a sentence-length score and a technical vocabulary density score. */
  double measuredDepth(String body, List<String> words) {
    if (words.isEmpty()) {
      return 0.0;
    }
    long sentences =
        Arrays.stream(SENTENCE_BREAK.split(body.replace('\n', ' ')))
            .filter(s -> !s.isBlank())
            .count();
    double avgSentenceWords = (double) words.size() / Math.max(1, sentences);
    double lengthScore =
        clamp(
            (avgSentenceWords - SHORT_SENTENCE_WORDS)
                / (LONG_SENTENCE_WORDS - SHORT_SENTENCE_WORDS));

    long technical =
        words.stream()
            .filter(w -> w.length() >= LONG_WORD_LENGTH || TECHNICAL_TERMS.contains(w))
            .count();
    double densityScore =
        clamp(((double) technical / words.size()) / TECHNICAL_DENSITY_SATURATION);

    return (lengthScore + densityScore) / 2.0;
  }

  double measuredQuantitative(List<String> words) {
    if (words.isEmpty()) {
      return 0.0;
    }
    long indicators =
        words.stream()
            .filter(
                w ->
                    NUMERIC.matcher(w).matches()
                        || w.endsWith("%")
                        || STATISTICAL_TERMS.contains(w))
            .count();
    double per100 = indicators * 100.0 / words.size();
    return clamp(per100 / config.getRelevance().getQuantitativeSaturation());
  }

  double positionImportance(int index, int totalSections) {
    if (totalSections <= 0) {
      return 0.0;
    }
    double position = 1.0 - (double) index / totalSections;
    int longDocument = config.getRelevance().getLongDocumentSections();
    if (totalSections > longDocument) {
      double damping = (double) longDocument / totalSections;
      position = 0.5 + (position - 0.5) * damping;
    }
    return clamp(position);
  }

  static List<String> words(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return Arrays.stream(WORD_SPLIT.split(text.toLowerCase(Locale.ROOT)))
        .map(RelevanceScorer::trimPunctuation)
        .filter(w -> !w.isEmpty())
        .toList();
  }

  private static String trimPunctuation(String word) {
    return word.replaceAll("^[.,-]+|[.,-]+$", "");
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }
}
