package com.flamingo.ai.tablerag.service.rag;

import com.flamingo.ai.tablerag.config.RagConfig;
import com.flamingo.ai.tablerag.exception.IngestionException;
import com.flamingo.ai.tablerag.exception.ReportNotFoundException;
import com.flamingo.ai.tablerag.service.rag.chunking.TextChunker;
import com.flamingo.ai.tablerag.service.rag.extraction.TableCropExtractor;
import com.flamingo.ai.tablerag.service.rag.index.IndexBuilder;
import com.flamingo.ai.tablerag.service.rag.index.IndexStore;
import com.flamingo.ai.tablerag.service.rag.index.VectorIndex;
import com.flamingo.ai.tablerag.service.rag.model.IndexNode;
import com.flamingo.ai.tablerag.service.rag.model.IngestReport;
import com.flamingo.ai.tablerag.service.rag.model.ReportDocument;
import com.flamingo.ai.tablerag.service.rag.model.SummarizationOutcome;
import com.flamingo.ai.tablerag.service.rag.model.TableArtifact;
import com.flamingo.ai.tablerag.service.rag.model.TableNode;
import com.flamingo.ai.tablerag.service.rag.model.TextNode;
import com.flamingo.ai.tablerag.service.rag.summary.TableSummarizationService;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

/**
 * Runs one ingest: crop tables, chunk text, summarize crops, embed everything and persist the
 * index. Per-page and per-table failures are logged and skipped; only a run that yields no nodes
 * at all fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

  private final TableCropExtractor tableCropExtractor;
  private final TextChunker textChunker;
  private final TableSummarizationService tableSummarizationService;
  private final IndexBuilder indexBuilder;
  private final IndexStore indexStore;
  private final RagConfig ragConfig;

  /** Ingests the configured report into the configured directories. */
  public IngestReport ingest() {
    RagConfig.Storage storage = ragConfig.getStorage();
    return ingest(
        Path.of(storage.getPdfPath()),
        Path.of(storage.getTableOutputDir()),
        Path.of(storage.getIndexDir()));
  }

  /**
   * Ingests {@code pdfPath}, writing table crops to {@code tableOutputDir} and the index to {@code
   * indexDir}.
   *
   * @throws ReportNotFoundException if the PDF does not exist; nothing is written in that case
   * @throws IngestionException if the PDF cannot be read, nothing was extracted, or the index
   *     cannot be persisted
   */
  @Timed(value = "ingest.duration", description = "Time to ingest one report")
  public IngestReport ingest(Path pdfPath, Path tableOutputDir, Path indexDir) {
    if (!Files.isRegularFile(pdfPath)) {
      throw new ReportNotFoundException(pdfPath);
    }
    log.info("Ingesting {}", pdfPath);

    ReportDocument document;
    List<TableArtifact> artifacts;
    List<TextNode> textNodes;
    try (PDDocument pdf = Loader.loadPDF(pdfPath.toFile())) {
      document = new ReportDocument(pdfPath, pdf.getNumberOfPages());
      log.info("Opened {} ({} pages)", document.path().getFileName(), document.pageCount());
      artifacts = tableCropExtractor.extract(pdf, tableOutputDir);
      textNodes = textChunker.chunk(pdf);
    } catch (IOException e) {
      throw new IngestionException("Cannot read PDF " + pdfPath + ": " + e.getMessage(), e);
    }
    log.info(
        "Extracted {} table crops and {} text chunks from {} pages",
        artifacts.size(),
        textNodes.size(),
        document.pageCount());

    List<TableNode> tableNodes = new ArrayList<>();
    int failed = 0;
    for (SummarizationOutcome outcome : tableSummarizationService.summarizeAll(artifacts)) {
      if (outcome instanceof SummarizationOutcome.Summarized summarized) {
        tableNodes.add(summarized.node());
      } else {
        failed++;
      }
    }

    List<IndexNode> nodes = new ArrayList<>(textNodes.size() + tableNodes.size());
    nodes.addAll(textNodes);
    nodes.addAll(tableNodes);
    if (nodes.isEmpty()) {
      throw new IngestionException("No text or table content extracted from " + pdfPath);
    }

    VectorIndex index = indexBuilder.build(nodes);
    try {
      indexStore.persist(index, indexDir);
    } catch (IOException e) {
      throw new IngestionException("Cannot persist index to " + indexDir, e);
    }

    IngestReport report =
        new IngestReport(
            document.pageCount(),
            textNodes.size(),
            artifacts.size(),
            tableNodes.size(),
            failed,
            indexDir);
    log.info(
        "Ingest complete: {} nodes ({} text, {} table, {} summaries failed) in {}",
        report.totalNodes(),
        report.textNodes(),
        report.tableNodes(),
        report.failedSummaries(),
        indexDir);
    return report;
  }
}
