package com.flamingo.ai.docinsight.service.extraction.model;

/**
 * Minimal styled text fragment produced by a {@link
 * com.flamingo.ai.docinsight.service.extraction.TextRunExtractor}.
 *
 * @param text the fragment text, possibly a single character
 * @param fontSize font size in points
 * @param fontName font family name as reported by the PDF
 * @param bold whether the font is bold
 * @param italic whether the font is italic or oblique
 * @param bbox position on the page
 * @param pageIndex 0-based page index
 */
public record TextRun(
    String text,
    float fontSize,
    String fontName,
    boolean bold,
    boolean italic,
    BoundingBox bbox,
    int pageIndex) {}
