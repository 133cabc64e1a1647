package com.flamingo.ai.docinsight.service.extraction.model;

import java.util.List;

/**
 * The text runs of one page.
 *
 * @param pageIndex 0-based page index
 * @param pageHeight page height in points; non-positive when unknown
 * @param runs runs in extraction order
 */
public record PageRuns(int pageIndex, float pageHeight, List<TextRun> runs) {}
