package com.flamingo.ai.docinsight.support;

import com.flamingo.ai.docinsight.service.extraction.model.BoundingBox;
import com.flamingo.ai.docinsight.service.extraction.model.PageRuns;
import com.flamingo.ai.docinsight.service.extraction.model.RawDocument;
import com.flamingo.ai.docinsight.service.extraction.model.TextRun;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link RawDocument}s line by line for tests.
 *
 * <p>Each line is a single run starting at x=72. Lines on a page start at y=72 and advance by 1.6
 * times the font size. Pages are 792 pt high.
 */
public final class TestDocuments {

  public static final float PAGE_HEIGHT = 792f;
  public static final float LEFT_MARGIN = 72f;
  public static final float TOP_MARGIN = 72f;

  public static final String BODY_SENTENCE =
      "The committee reviewed the proposal and agreed on the next steps for the project team.";

  private final String documentId;
  private final List<PageRuns> pages = new ArrayList<>();
  private List<TextRun> currentRuns;
  private float cursorY;

  private TestDocuments(String documentId) {
    this.documentId = documentId;
  }

  public static TestDocuments document(String documentId) {
    return new TestDocuments(documentId);
  }

  public TestDocuments page() {
    flushPage();
    currentRuns = new ArrayList<>();
    cursorY = TOP_MARGIN;
    return this;
  }

  public TestDocuments line(String text, float size, boolean bold) {
    if (currentRuns == null) {
      page();
    }
    currentRuns.add(run(text, size, bold, LEFT_MARGIN, cursorY, pages.size()));
    cursorY += size * 1.6f;
    return this;
  }

  public TestDocuments heading(String text, float size) {
    return line(text, size, true);
  }

  public TestDocuments body(String text) {
    return line(text, 10f, false);
  }

  /** Adds {@code count} lines of 10 pt body prose. */
  public TestDocuments paragraph(int count) {
    for (int i = 0; i < count; i++) {
      body(BODY_SENTENCE);
    }
    return this;
  }

  public RawDocument build() {
    flushPage();
    return new RawDocument(documentId, List.copyOf(pages));
  }

  public static TextRun run(
      String text, float size, boolean bold, float x0, float y0, int pageIndex) {
    float width = text.length() * size * 0.5f;
    return new TextRun(
        text,
        size,
        bold ? "Helvetica-Bold" : "Helvetica",
        bold,
        false,
        new BoundingBox(x0, y0, x0 + width, y0 + size),
        pageIndex);
  }

  private void flushPage() {
    if (currentRuns != null) {
      pages.add(new PageRuns(pages.size(), PAGE_HEIGHT, List.copyOf(currentRuns)));
      currentRuns = null;
    }
  }
}
