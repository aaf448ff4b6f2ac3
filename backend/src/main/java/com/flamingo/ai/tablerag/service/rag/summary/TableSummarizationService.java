package com.flamingo.ai.tablerag.service.rag.summary;

import com.flamingo.ai.tablerag.exception.IngestionException;
import com.flamingo.ai.tablerag.service.rag.model.SummarizationOutcome;
import com.flamingo.ai.tablerag.service.rag.model.TableArtifact;
import com.flamingo.ai.tablerag.service.rag.model.TableNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Converts table crops into searchable {@link TableNode}s with one vision-language call per crop.
 *
 * <p>Calls run on the {@code tableSummaryExecutor} pool, whose size caps the number of in-flight
 * requests. Each task hands its {@link SummarizationOutcome} back through its own future; the
 * calling thread is the only consumer and drains them in completion order. A failed crop is
 * logged and dropped without touching the others.
 */
@Service
@Slf4j
public class TableSummarizationService {

  static final String TABLE_SUMMARY_INSTRUCTION =
      "Analyze this image of a financial table. "
          + "Output a comprehensive text summary of the data it contains, "
          + "including column headers and key row values, so that it can be retrieved via search. "
          + "Do not include Markdown formatting like ```json or ```text, just the clean summary.";

  private final TableVisionClient visionClient;
  private final Executor executor;
  private final MeterRegistry meterRegistry;

  public TableSummarizationService(
      TableVisionClient visionClient,
      @Qualifier("tableSummaryExecutor") Executor executor,
      MeterRegistry meterRegistry) {
    this.visionClient = visionClient;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Summarizes every artifact on the bounded pool.
   *
   * @return one outcome per artifact, in completion order
   */
  public List<SummarizationOutcome> summarizeAll(List<TableArtifact> artifacts) {
    if (artifacts.isEmpty()) {
      log.info("No table images found to process.");
      return List.of();
    }

    log.info("Summarizing {} table images", artifacts.size());
    CompletionService<SummarizationOutcome> completionService =
        new ExecutorCompletionService<>(executor);
    for (TableArtifact artifact : artifacts) {
      completionService.submit(() -> summarize(artifact));
    }

    List<SummarizationOutcome> outcomes = new ArrayList<>(artifacts.size());
    try {
      for (int i = 0; i < artifacts.size(); i++) {
        SummarizationOutcome outcome = completionService.take().get();
        outcomes.add(outcome);
        log.debug(
            "[{}/{}] Analyzed {}", i + 1, artifacts.size(), outcome.artifact().fileName());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IngestionException("Interrupted while waiting for table summaries", e);
    } catch (ExecutionException e) {
      // summarize() catches everything it can; reaching here means an Error escaped a task
      throw new IngestionException("Table summarization task crashed", e.getCause());
    }

    long succeeded =
        outcomes.stream().filter(SummarizationOutcome.Summarized.class::isInstance).count();
    log.info(
        "Generated {} table nodes from {} images ({} failed)",
        succeeded,
        artifacts.size(),
        artifacts.size() - succeeded);
    return outcomes;
  }

  /** Summarizes a single artifact. Never throws for provider or file errors. */
  public SummarizationOutcome summarize(TableArtifact artifact) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      byte[] pngBytes = Files.readAllBytes(artifact.imagePath());
      String summary = stripCodeFences(visionClient.describe(pngBytes, TABLE_SUMMARY_INSTRUCTION));
      if (summary.isBlank()) {
        return failed(artifact, "empty summary");
      }

      TableNode node =
          new TableNode(
              "table-" + artifact.fileName(),
              summary,
              artifact.imagePath().toString(),
              artifact.fileName(),
              artifact.pageNumber());
      meterRegistry.counter("table.summary.success").increment();
      return new SummarizationOutcome.Summarized(artifact, node);
    } catch (IOException e) {
      return failed(artifact, "unreadable image: " + e.getMessage());
    } catch (RuntimeException e) {
      return failed(artifact, e.getMessage());
    } finally {
      sample.stop(meterRegistry.timer("table.summary.duration"));
    }
  }

  private SummarizationOutcome failed(TableArtifact artifact, String reason) {
    log.warn("Error summarising {}: {}", artifact.fileName(), reason);
    meterRegistry.counter("table.summary.failure").increment();
    return new SummarizationOutcome.Failed(artifact, reason);
  }

  /** Removes a surrounding Markdown code fence that some models add despite the instruction. */
  static String stripCodeFences(String reply) {
    if (reply == null) {
      return "";
    }
    String text = reply.strip();
    if (text.startsWith("```")) {
      int firstNewline = text.indexOf('\n');
      text = firstNewline >= 0 ? text.substring(firstNewline + 1) : "";
      if (text.endsWith("```")) {
        text = text.substring(0, text.length() - 3);
      }
    }
    return text.strip();
  }
}
