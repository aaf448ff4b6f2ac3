package com.flamingo.ai.tablerag.service.rag.extraction;

import com.flamingo.ai.tablerag.config.RagConfig;
import com.flamingo.ai.tablerag.exception.IngestionException;
import com.flamingo.ai.tablerag.service.rag.detection.TableRegionDetector;
import com.flamingo.ai.tablerag.service.rag.model.TableArtifact;
import com.flamingo.ai.tablerag.service.rag.model.TableRegion;
import io.micrometer.core.instrument.MeterRegistry;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Renders every page of a report, runs table detection on it and writes each detected table as a
 * standalone PNG.
 *
 * <p>Files are named {@code p{page}_table_{sequence}.png} where {@code page} is 1-based and {@code
 * sequence} counts crops over the whole run, so the same detector output always yields the same
 * files. The output directory is wiped at the start of every run.
 *
 * <p>A page that fails to render or whose detection call fails is logged and skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TableCropExtractor {

  private static final float MIN_RENDER_SCALE = 2.0f;

  private final TableRegionDetector detector;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Extracts all table crops from the document.
   *
   * @param pdf an open PDF; not closed by this method
   * @param outputDir directory that receives the crops; cleared before writing
   * @return the written artifacts in page order
   */
  public List<TableArtifact> extract(PDDocument pdf, Path outputDir) {
    RagConfig.Detection detection = ragConfig.getDetection();
    float scale = detection.getRenderScale();
    if (scale < MIN_RENDER_SCALE) {
      throw new IllegalArgumentException(
          "rag.detection.render-scale must be at least " + MIN_RENDER_SCALE + ", got " + scale);
    }

    resetOutputDirectory(outputDir);

    PDFRenderer renderer = new PDFRenderer(pdf);
    int pageCount = pdf.getNumberOfPages();
    List<TableArtifact> artifacts = new ArrayList<>();
    int failedPages = 0;

    log.info("Scanning {} pages for tables (scale={}x)", pageCount, scale);

    for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
      BufferedImage pageImage;
      List<TableRegion> regions;
      try {
        pageImage = renderer.renderImage(pageIndex, scale);
        regions = detector.detect(pageImage, pageIndex, detection.getConfidenceFloor());
      } catch (IOException | RuntimeException e) {
        log.warn("Table detection failed on page {}, skipping: {}", pageIndex + 1, e.getMessage());
        meterRegistry.counter("table.extraction.pages.failed").increment();
        failedPages++;
        continue;
      }

      for (TableRegion region : regions) {
        if (region.confidence() < detection.getConfidenceFloor()) {
          continue;
        }
        TableArtifact artifact = writeCrop(pageImage, region, outputDir, artifacts.size());
        if (artifact != null) {
          artifacts.add(artifact);
        }
      }
    }

    meterRegistry.counter("table.extraction.crops").increment(artifacts.size());
    log.info(
        "Extracted {} tables to '{}' ({} pages skipped)", artifacts.size(), outputDir, failedPages);
    return artifacts;
  }

  private void resetOutputDirectory(Path outputDir) {
    try {
      FileSystemUtils.deleteRecursively(outputDir);
      Files.createDirectories(outputDir);
    } catch (IOException e) {
      throw new IngestionException("Cannot prepare table output directory " + outputDir, e);
    }
  }

  /**
   * Crops one region and writes it.
   *
   * @return the artifact, or null if the region is empty after clipping or the write failed
   */
  private TableArtifact writeCrop(
      BufferedImage pageImage, TableRegion region, Path outputDir, int sequence) {
    int x1 = clamp((int) region.x1(), pageImage.getWidth());
    int y1 = clamp((int) region.y1(), pageImage.getHeight());
    int x2 = clamp((int) region.x2(), pageImage.getWidth());
    int y2 = clamp((int) region.y2(), pageImage.getHeight());
    if (x2 <= x1 || y2 <= y1) {
      log.debug("Ignoring degenerate table box {} on page {}", region, region.pageIndex() + 1);
      return null;
    }

    int pageNumber = region.pageIndex() + 1;
    Path target = outputDir.resolve(TableArtifact.fileNameFor(pageNumber, sequence));
    try {
      BufferedImage crop = pageImage.getSubimage(x1, y1, x2 - x1, y2 - y1);
      ImageIO.write(crop, "png", target.toFile());
    } catch (IOException e) {
      log.warn("Failed to write table crop {}: {}", target.getFileName(), e.getMessage());
      return null;
    }
    log.debug(
        "Found table on page {} ({}x{} px, conf={}) -> {}",
        pageNumber,
        x2 - x1,
        y2 - y1,
        region.confidence(),
        target.getFileName());
    return new TableArtifact(target.toAbsolutePath(), pageNumber, sequence);
  }

  private static int clamp(int value, int max) {
    return Math.max(0, Math.min(value, max));
  }
}
