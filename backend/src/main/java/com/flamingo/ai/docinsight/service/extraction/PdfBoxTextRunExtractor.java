package com.flamingo.ai.docinsight.service.extraction;

import com.flamingo.ai.docinsight.exception.DocumentProcessingException;
import com.flamingo.ai.docinsight.service.extraction.model.BoundingBox;
import com.flamingo.ai.docinsight.service.extraction.model.PageRuns;
import com.flamingo.ai.docinsight.service.extraction.model.RawDocument;
import com.flamingo.ai.docinsight.service.extraction.model.TextRun;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Service;

/**
 * {@link TextRunExtractor} for PDF documents.
 *
 * <p>Uses Apache PDFBox 3.x. Every {@code writeString} callback of the text stripper is split into
 * runs of uniform font and size; bold and italic are read from the font descriptor and fall back
 * to the font name ({@code Helvetica-Bold}, {@code Times-Italic}). Scanned pages produce no runs.
 */
@Service
@Slf4j
public class PdfBoxTextRunExtractor implements TextRunExtractor {

  private static final float DEFAULT_FONT_SIZE = 12.0f;
  private static final float BOLD_WEIGHT = 600f;

  @Override
  public RawDocument extract(String documentId, InputStream inputStream) {
    try {
      byte[] bytes = inputStream.readAllBytes();
      try (PDDocument pdfDoc = Loader.loadPDF(bytes)) {
        RunCollectingStripper stripper = new RunCollectingStripper();
        stripper.getText(pdfDoc);
        List<PageRuns> pages = stripper.getPages();
        log.debug(
            "Extracted {} runs from {} pages of {}",
            pages.stream().mapToInt(p -> p.runs().size()).sum(),
            pages.size(),
            documentId);
        return new RawDocument(documentId, pages);
      }
    } catch (IOException e) {
      log.debug("PDFBox could not load {}", documentId, e);
      throw new DocumentProcessingException(
          documentId, "Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  static boolean isBold(PDFont font) {
    if (font == null) {
      return false;
    }
    PDFontDescriptor descriptor = font.getFontDescriptor();
    if (descriptor != null
        && (descriptor.isForceBold() || descriptor.getFontWeight() >= BOLD_WEIGHT)) {
      return true;
    }
    String name = fontName(font).toLowerCase(Locale.ROOT);
    return name.contains("bold")
        || name.contains("black")
        || name.contains("heavy")
        || name.contains("semibold");
  }

  static boolean isItalic(PDFont font) {
    if (font == null) {
      return false;
    }
    PDFontDescriptor descriptor = font.getFontDescriptor();
    if (descriptor != null && (descriptor.isItalic() || descriptor.getItalicAngle() != 0f)) {
      return true;
    }
    String name = fontName(font).toLowerCase(Locale.ROOT);
    return name.contains("italic") || name.contains("oblique");
  }

  private static String fontName(PDFont font) {
    return font != null && font.getName() != null ? font.getName() : "";
  }

  /** Collects per-page text runs during PDFTextStripper traversal. */
  private static final class RunCollectingStripper extends PDFTextStripper {

    private final List<PageRuns> pages = new ArrayList<>();
    private List<TextRun> currentRuns = new ArrayList<>();
    private float currentPageHeight;

    RunCollectingStripper() throws IOException {
      super();
      setSortByPosition(true);
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
      currentRuns = new ArrayList<>();
      currentPageHeight = page.getMediaBox() != null ? page.getMediaBox().getHeight() : 0f;
      super.startPage(page);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
      List<TextPosition> pending = new ArrayList<>();
      for (TextPosition pos : textPositions) {
        if (!pending.isEmpty() && !sameStyle(pending.get(pending.size() - 1), pos)) {
          flushRun(pending);
        }
        pending.add(pos);
      }
      flushRun(pending);
      super.writeString(text, textPositions);
    }

    @Override
    protected void endPage(PDPage page) throws IOException {
      pages.add(new PageRuns(getCurrentPageNo() - 1, currentPageHeight, List.copyOf(currentRuns)));
      super.endPage(page);
    }

    List<PageRuns> getPages() {
      return List.copyOf(pages);
    }

    private boolean sameStyle(TextPosition a, TextPosition b) {
      return a.getFont() == b.getFont()
          && Math.abs(a.getFontSizeInPt() - b.getFontSizeInPt()) < 0.05f
          && Math.abs(a.getYDirAdj() - b.getYDirAdj()) <= 2.0f;
    }

    private void flushRun(List<TextPosition> positions) {
      if (positions.isEmpty()) {
        return;
      }
      StringBuilder text = new StringBuilder();
      float x0 = Float.MAX_VALUE;
      float y0 = Float.MAX_VALUE;
      float x1 = -Float.MAX_VALUE;
      float y1 = -Float.MAX_VALUE;
      for (TextPosition pos : positions) {
        text.append(pos.getUnicode());
        x0 = Math.min(x0, pos.getXDirAdj());
        x1 = Math.max(x1, pos.getXDirAdj() + pos.getWidthDirAdj());
        y0 = Math.min(y0, pos.getYDirAdj() - pos.getHeightDir());
        y1 = Math.max(y1, pos.getYDirAdj());
      }
      TextPosition first = positions.get(0);
      float size = first.getFontSizeInPt() > 0 ? first.getFontSizeInPt() : DEFAULT_FONT_SIZE;
      PDFont font = first.getFont();
      currentRuns.add(
          new TextRun(
              text.toString(),
              size,
              fontName(font),
              isBold(font),
              isItalic(font),
              new BoundingBox(x0, y0, x1, y1),
              getCurrentPageNo() - 1));
      positions.clear();
    }
  }
}
