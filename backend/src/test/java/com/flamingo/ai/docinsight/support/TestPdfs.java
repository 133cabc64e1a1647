package com.flamingo.ai.docinsight.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/** Writes small Letter-size PDFs with Helvetica text for extraction tests. */
public final class TestPdfs {

  public record TextLine(String text, float size, boolean bold) {

    public static TextLine heading(String text, float size) {
      return new TextLine(text, size, true);
    }

    public static TextLine body(String text) {
      return new TextLine(text, 10f, false);
    }
  }

  private TestPdfs() {}

  /** One inner list per page, lines laid out top to bottom from y=720. */
  public static byte[] pdf(List<List<TextLine>> pages) throws IOException {
    PDType1Font regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    PDType1Font bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      for (List<TextLine> lines : pages) {
        PDPage page = new PDPage(PDRectangle.LETTER);
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          float y = 720f;
          for (TextLine line : lines) {
            content.beginText();
            content.setFont(line.bold() ? bold : regular, line.size());
            content.newLineAtOffset(72f, y);
            content.showText(line.text());
            content.endText();
            y -= line.size() * 1.8f;
          }
        }
      }
      document.save(out);
      return out.toByteArray();
    }
  }
}
