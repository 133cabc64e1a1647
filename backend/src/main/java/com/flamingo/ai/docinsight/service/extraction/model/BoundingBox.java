package com.flamingo.ai.docinsight.service.extraction.model;

/**
 * Axis-aligned box of a text run in page coordinates, y growing downwards from the page top.
 *
 * @param x0 left edge
 * @param y0 top edge
 * @param x1 right edge
 * @param y1 bottom edge
 */
public record BoundingBox(float x0, float y0, float x1, float y1) {}
