package com.flamingo.ai.docinsight.service.structure.model;

import java.util.regex.Pattern;

/** Small text predicates shared by the title detector and the heading policy. */
public final class TextHeuristics {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TextHeuristics() {}

  public static int wordCount(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    return WHITESPACE.split(text.trim()).length;
  }

  public static String collapseWhitespace(String text) {
    return text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  public static boolean hasLetter(String text) {
    return text != null && text.codePoints().anyMatch(Character::isLetter);
  }

  /** All letters upper case, with at least two letters. */
  public static boolean isAllCaps(String text) {
    if (text == null) {
      return false;
    }
    long letters = text.codePoints().filter(Character::isLetter).count();
    return letters >= 2 && text.codePoints().filter(Character::isLowerCase).findAny().isEmpty();
  }

  /** Title case or sentence case: the first letter is upper case and the text is not all caps. */
  public static boolean isTitleOrSentenceCase(String text) {
    if (text == null || isAllCaps(text)) {
      return false;
    }
    return text.codePoints().filter(Character::isLetter).findFirst().stream()
        .anyMatch(Character::isUpperCase);
  }

  public static boolean endsWithBodyPunctuation(String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    char last = text.trim().charAt(text.trim().length() - 1);
    return last == '.' || last == ',' || last == ';';
  }
}
