package com.flamingo.ai.docinsight.service.persona;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Extracts lower-cased content words from persona and job descriptions.
 *
 * <p>Tokens keep Unicode letters and digits, drop English stop words and generic role filler, and
 * are deduplicated in first-seen order.
 */
@Component
public class KeywordExtractor {

  public static final int DEFAULT_MIN_LENGTH = 4;

  // Common English stop words
  static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "but", "they", "have", "had", "what", "when", "where", "who", "which", "why", "how",
          "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no",
          "nor", "not", "only", "own", "same", "so", "than", "too", "very", "just", "can", "should",
          "now", "been", "being", "do", "does", "did", "doing", "would", "could", "might", "must",
          "shall", "may", "about", "above", "after", "again", "against", "before", "below",
          "between", "down", "during", "into", "over", "through", "under", "until", "up", "while",
          "am", "i", "me", "my", "we", "our", "you", "your", "him", "her", "them", "their", "if",
          "then", "also", "here", "there", "these", "those", "else", "any", "many", "much", "even");

  // Words that describe the request rather than its subject
  static final Set<String> FILLER_WORDS =
      Set.of(
          "experience", "experienced", "years", "year", "working", "someone", "person", "need",
          "needs", "want", "wants", "like", "based", "using", "given", "help", "make", "provide",
          "relevant", "various", "within", "across", "well", "good", "able");

  public List<String> extractTerms(String text) {
    return extractTerms(text, DEFAULT_MIN_LENGTH);
  }

  /**
   * Extracts distinct content words of at least {@code minLength} characters.
   *
   * @param text free text, may be {@code null}
   * @param minLength minimum token length
   * @return distinct lower-cased terms in first-seen order
   */
  public List<String> extractTerms(String text, int minLength) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    Set<String> terms =
        tokenize(text).stream()
            .filter(t -> t.length() >= minLength)
            .filter(t -> t.chars().anyMatch(Character::isLetter))
            .filter(t -> !STOP_WORDS.contains(t) && !FILLER_WORDS.contains(t))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    return List.copyOf(terms);
  }

  /** Splits on anything that is not a letter, digit or apostrophe, lower-casing the result. */
  public List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}']+"))
        .map(w -> w.replaceAll("^'+|'+$", ""))
        .filter(w -> !w.isEmpty())
        .collect(Collectors.toList());
  }

  public boolean isStopWord(String token) {
    return STOP_WORDS.contains(token) || FILLER_WORDS.contains(token);
  }
}
