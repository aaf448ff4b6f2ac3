package com.flamingo.ai.tablerag.service.rag.chunking;

import com.flamingo.ai.tablerag.config.RagConfig;
import com.flamingo.ai.tablerag.exception.IngestionException;
import com.flamingo.ai.tablerag.service.rag.model.TextNode;
import java.io.IOException;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * Splits the text of a report into overlapping, page-tagged windows.
 *
 * <p>Text is extracted one page at a time so every chunk belongs to exactly one page. Each page is
 * cut into windows of {@code rag.chunking.size} characters; consecutive windows share {@code
 * rag.chunking.overlap} characters. A window end is moved back to the last whitespace in the second
 * half of the window when there is one, so words are not cut in two.
 *
 * <p>The output depends only on the document and the two settings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextChunker {

  private final RagConfig ragConfig;

  /**
   * Chunks every page of the document.
   *
   * @param pdf an open PDF; not closed by this method
   * @return text nodes in page order, then in-page order
   */
  public List<TextNode> chunk(PDDocument pdf) {
    int size = ragConfig.getChunking().getSize();
    int overlap = ragConfig.getChunking().getOverlap();
    validate(size, overlap);

    List<TextNode> nodes = new ArrayList<>();
    int pageCount = pdf.getNumberOfPages();
    try {
      PDFTextStripper stripper = new PDFTextStripper();
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String pageText = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC);

        List<String> windows = window(pageText, size, overlap);
        for (int i = 0; i < windows.size(); i++) {
          nodes.add(new TextNode("text-p" + page + "-" + i, windows.get(i), page));
        }
      }
    } catch (IOException e) {
      throw new IngestionException("Failed to extract text from PDF", e);
    }

    log.info("Generated {} text nodes from {} pages", nodes.size(), pageCount);
    return nodes;
  }

  /**
   * Cuts {@code text} into overlapping windows. Blank windows are dropped and every window is
   * trimmed.
   */
  public static List<String> window(String text, int size, int overlap) {
    validate(size, overlap);
    List<String> windows = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return windows;
    }

    String normalized = text.replace("\r\n", "\n").strip();
    int length = normalized.length();
    int start = 0;

    while (start < length) {
      int end = Math.min(start + size, length);
      if (end < length) {
        end = snapToWhitespace(normalized, start, end);
      }

      String window = normalized.substring(start, end).strip();
      if (!window.isEmpty()) {
        windows.add(window);
      }
      if (end >= length) {
        break;
      }
      start = Math.max(end - overlap, start + 1);
    }
    return windows;
  }

  private static int snapToWhitespace(String text, int start, int end) {
    int floor = start + (end - start) / 2;
    for (int i = end; i > floor; i--) {
      if (Character.isWhitespace(text.charAt(i - 1))) {
        return i;
      }
    }
    return end;
  }

  private static void validate(int size, int overlap) {
    if (size <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive, got " + size);
    }
    if (overlap < 0 || overlap >= size) {
      throw new IllegalArgumentException(
          "Chunk overlap must be in [0, size), got overlap=" + overlap + ", size=" + size);
    }
  }
}
