package com.flamingo.ai.docinsight.service.structure.model;

/**
 * Outcome of the heading pattern rules for one line.
 *
 * @param kind which rule matched
 * @param depth numbering depth for structural patterns, 0 otherwise
 */
public record PatternMatch(Kind kind, int depth) {

  private static final PatternMatch NO_MATCH = new PatternMatch(Kind.NONE, 0);

  public enum Kind {
    NUMBERED,
    /** "3 Results": a single number without a dot, also how list items and wrapped lines start. */
    BARE_NUMBERED,
    CHAPTER,
    APPENDIX,
    ALL_CAPS,
    BOLD_SHORT,
    NONE
  }

  public static PatternMatch none() {
    return NO_MATCH;
  }

  public boolean matched() {
    return kind != Kind.NONE;
  }

  /** True when the match carries numbering, which outranks font size. */
  public boolean isStructural() {
    return depth > 0;
  }
}
