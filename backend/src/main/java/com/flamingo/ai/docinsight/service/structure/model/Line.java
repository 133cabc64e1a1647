package com.flamingo.ai.docinsight.service.structure.model;

import com.flamingo.ai.docinsight.service.extraction.model.TextRun;
import java.util.List;

/**
 * Text runs sharing one visual baseline, ordered left to right.
 *
 * @param text concatenated, whitespace-collapsed text
 * @param fontSize dominant font size, rounded to 0.1 pt
 * @param fontName font name of the dominant run
 * @param bold whether a strict majority of runs is bold
 * @param italic whether a strict majority of runs is italic
 * @param pageIndex 0-based page index
 * @param x0 left edge of the first run
 * @param y0 top edge of the highest run
 * @param runs the underlying runs
 */
public record Line(
    String text,
    float fontSize,
    String fontName,
    boolean bold,
    boolean italic,
    int pageIndex,
    float x0,
    float y0,
    List<TextRun> runs) {

  public int wordCount() {
    return TextHeuristics.wordCount(text);
  }
}
