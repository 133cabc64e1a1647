package com.flamingo.ai.docinsight.service.relevance;

import com.flamingo.ai.docinsight.config.DocInsightConfig;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Cleans section text into a length-capped excerpt. */
@Component
@RequiredArgsConstructor
public class ExcerptRefiner {

  static final String ELLIPSIS = "...";

  private static final Pattern HYPHENATED_BREAK = Pattern.compile("(\\p{L})-\\s*\\n\\s*(\\p{L})");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final DocInsightConfig config;

  /**
   * Joins hyphenated line breaks, collapses whitespace and cuts at a word boundary.
   *
   * @param rawText section text with line breaks
   * @return the excerpt, with {@value #ELLIPSIS} appended when cut
   */
  public String refine(String rawText) {
    if (rawText == null || rawText.isBlank()) {
      return "";
    }
    String text = HYPHENATED_BREAK.matcher(rawText).replaceAll("$1$2");
    text = WHITESPACE.matcher(text).replaceAll(" ").trim();

    int maxChars = config.getSelection().getExcerptMaxChars();
    if (text.length() <= maxChars) {
      return text;
    }
    String cut = text.substring(0, maxChars);
    // Mid-word cut: back off to the last space
    if (!Character.isWhitespace(text.charAt(maxChars))) {
      int lastSpace = cut.lastIndexOf(' ');
      if (lastSpace > 0) {
        cut = cut.substring(0, lastSpace);
      }
    }
    return cut.stripTrailing() + ELLIPSIS;
  }
}
