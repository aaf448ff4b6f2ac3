package com.flamingo.ai.tablerag.support;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

/** Builds small in-memory PDFs and PNGs for tests. */
public final class TestPdfs {

  private TestPdfs() {}

  /** One A4 page per argument; an empty string gives a blank page. Lines split on '\n'. */
  public static PDDocument withPages(String... pageTexts) throws IOException {
    PDDocument document = new PDDocument();
    PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    for (String text : pageTexts) {
      PDPage page = new PDPage(PDRectangle.A4);
      document.addPage(page);
      if (text.isEmpty()) {
        continue;
      }
      try (PDPageContentStream content = new PDPageContentStream(document, page)) {
        content.beginText();
        content.setFont(font, 11);
        content.setLeading(14);
        content.newLineAtOffset(50, 780);
        for (String line : text.split("\n")) {
          content.showText(line);
          content.newLine();
        }
        content.endText();
      }
    }
    return document;
  }

  /** Writes a PDF built by {@link #withPages} to {@code file}. */
  public static Path write(Path file, String... pageTexts) throws IOException {
    try (PDDocument document = withPages(pageTexts)) {
      document.save(file.toFile());
    }
    return file;
  }

  /** Writes a white PNG of the given size. */
  public static Path png(Path file, int width, int height) throws IOException {
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    ImageIO.write(image, "png", file.toFile());
    return file;
  }
}
