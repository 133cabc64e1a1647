package com.flamingo.ai.docinsight.service.persona;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a {@link PersonaProfile} from free-text persona and job descriptions.
 *
 * <p>Classification counts whole-word hits against each {@link PersonaType} vocabulary. The job
 * text is consulted only when the persona text matches nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PersonaAnalyzer {

  private static final Map<Pattern, List<String>> DOMAIN_EXPANSIONS = new LinkedHashMap<>();
  private static final Map<String, List<String>> JOB_PHRASE_EXPANSIONS = new LinkedHashMap<>();

  static {
    DOMAIN_EXPANSIONS.put(
        Pattern.compile("computational biology|drug discovery", Pattern.CASE_INSENSITIVE),
        List.of("computational", "biology", "drug", "discovery", "methodology", "datasets"));
    DOMAIN_EXPANSIONS.put(
        Pattern.compile("\\b(investment|financial|analyst)", Pattern.CASE_INSENSITIVE),
        List.of("financial", "investment", "revenue", "market", "analysis"));
    DOMAIN_EXPANSIONS.put(
        Pattern.compile("\\b(chemistry|organic)", Pattern.CASE_INSENSITIVE),
        List.of("chemistry", "organic", "reaction", "kinetics", "mechanisms"));
    DOMAIN_EXPANSIONS.put(
        Pattern.compile("machine learning|deep learning", Pattern.CASE_INSENSITIVE),
        List.of("model", "training", "datasets", "evaluation", "benchmarks"));

    JOB_PHRASE_EXPANSIONS.put(
        "literature review", List.of("methodology", "datasets", "performance", "benchmarks"));
    JOB_PHRASE_EXPANSIONS.put("revenue trends", List.of("revenue", "trends", "financial"));
    JOB_PHRASE_EXPANSIONS.put(
        "exam preparation", List.of("concepts", "mechanisms", "definitions", "examples"));
  }

  private static final Pattern ACTION_OBJECT =
      Pattern.compile(
          "\\b(?:analy[sz]e|identify|prepare|summari[sz]e|compare|plan)\\s+"
              + "(?:(?:the|a|an|all|key|main)\\s+)*([\\p{L}][\\p{L}\\p{N}-]*)",
          Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

  private final KeywordExtractor keywordExtractor;
  private final PersonaPreferenceTable preferenceTable;

  /**
   * Analyzes a persona and job description.
   *
   * @param personaText persona description, may be blank
   * @param jobText job-to-be-done description, may be blank
   * @return the profile; neutral preferences when the persona text is blank
   */
  public PersonaProfile analyze(String personaText, String jobText) {
    Set<String> jobPriorities = extractJobPriorities(jobText);

    if (personaText == null || personaText.isBlank()) {
      log.debug("Blank persona, using neutral profile with {} job keywords", jobPriorities.size());
      PersonaProfile neutral = PersonaProfile.neutral();
      return new PersonaProfile(
          neutral.type(),
          Set.of(),
          Collections.unmodifiableSet(jobPriorities),
          neutral.preferences());
    }

    PersonaType type = classify(personaText, jobText);
    Set<String> expertise = extractExpertise(personaText);
    PersonaProfile profile =
        new PersonaProfile(
            type,
            Collections.unmodifiableSet(expertise),
            Collections.unmodifiableSet(jobPriorities),
            preferenceTable.preferences(type));

    log.debug(
        "Persona classified as {} with {} expertise and {} job keywords",
        type.tag(),
        expertise.size(),
        jobPriorities.size());
    return profile;
  }

  /** Most vocabulary hits wins, ties in declaration order; job text is the fallback source. */
  PersonaType classify(String personaText, String jobText) {
    PersonaType byPersona = bestMatch(personaText);
    if (byPersona != null) {
      return byPersona;
    }
    PersonaType byJob = bestMatch(jobText);
    return byJob != null ? byJob : PersonaType.TECHNICAL_PROFESSIONAL;
  }

  Set<String> extractExpertise(String personaText) {
    Set<String> keywords = new LinkedHashSet<>(keywordExtractor.extractTerms(personaText));
    for (Map.Entry<Pattern, List<String>> expansion : DOMAIN_EXPANSIONS.entrySet()) {
      if (expansion.getKey().matcher(personaText).find()) {
        keywords.addAll(expansion.getValue());
      }
    }
    return keywords;
  }

  Set<String> extractJobPriorities(String jobText) {
    Set<String> priorities = new LinkedHashSet<>();
    if (jobText == null || jobText.isBlank()) {
      return priorities;
    }
    priorities.addAll(keywordExtractor.extractTerms(jobText));

    String lower = jobText.toLowerCase(Locale.ROOT);
    for (Map.Entry<String, List<String>> expansion : JOB_PHRASE_EXPANSIONS.entrySet()) {
      if (lower.contains(expansion.getKey())) {
        priorities.addAll(expansion.getValue());
      }
    }

    for (String object : actionObjects(jobText)) {
      if (object.length() >= 3 && !keywordExtractor.isStopWord(object)) {
        priorities.add(object);
      }
    }
    return priorities;
  }

  private List<String> actionObjects(String jobText) {
    List<String> objects = new ArrayList<>();
    Matcher matcher = ACTION_OBJECT.matcher(jobText);
    while (matcher.find()) {
      objects.add(matcher.group(1).toLowerCase(Locale.ROOT));
    }
    return objects;
  }

  private PersonaType bestMatch(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    Set<String> tokens = new LinkedHashSet<>(keywordExtractor.tokenize(text));
    PersonaType best = null;
    int bestHits = 0;
    for (PersonaType type : PersonaType.values()) {
      int hits = 0;
      for (String token : tokens) {
        if (type.vocabulary().contains(token)) {
          hits++;
        }
      }
      if (hits > bestHits) {
        best = type;
        bestHits = hits;
      }
    }
    return best;
  }
}
