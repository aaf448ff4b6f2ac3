package com.flamingo.ai.tablerag.cli;

import com.flamingo.ai.tablerag.service.rag.IngestionService;
import com.flamingo.ai.tablerag.service.rag.QueryService;
import com.flamingo.ai.tablerag.service.rag.model.IngestReport;
import com.flamingo.ai.tablerag.service.rag.model.QueryResponse;
import java.io.PrintStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Executes the ingest and query command modes and prints their results. App mode leaves the web
 * server running and does nothing here.
 */
@Component
@Slf4j
public class TableRagCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  private final ObjectProvider<IngestionService> ingestionService;
  private final ObjectProvider<QueryService> queryService;
  private final PrintStream out;
  private int exitCode;

  @Autowired
  public TableRagCommandRunner(
      ObjectProvider<IngestionService> ingestionService,
      ObjectProvider<QueryService> queryService) {
    this(ingestionService, queryService, System.out);
  }

  TableRagCommandRunner(
      ObjectProvider<IngestionService> ingestionService,
      ObjectProvider<QueryService> queryService,
      PrintStream out) {
    this.ingestionService = ingestionService;
    this.queryService = queryService;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    switch (CommandMode.resolve(args)) {
      case INGEST -> ingest();
      case QUERY -> query(CommandMode.queryText(args));
      case APP -> log.info("Web front-end started, POST /api/query to ask a question");
    }
  }

  private void ingest() {
    IngestReport report = ingestionService.getObject().ingest();
    out.printf(
        "Ingested %d pages: %d text chunks, %d of %d tables summarized. Index saved to %s%n",
        report.pageCount(),
        report.textNodes(),
        report.tableNodes(),
        report.tableArtifacts(),
        report.indexDir());
  }

  private void query(String question) {
    out.println("Question: " + question);
    QueryResponse response = queryService.getObject().query(question);

    switch (response.status()) {
      case NOT_INGESTED, FAILED -> {
        out.println("❌ " + response.errorMessage());
        exitCode = 1;
      }
      case ANSWERED -> printAnswer(response);
    }
  }

  private void printAnswer(QueryResponse response) {
    out.println();
    out.println("Answer:");
    out.println(response.answer());
    out.println();

    if (response.sourceImages().isEmpty()) {
      out.println("No visual tables cited for this answer.");
    } else {
      out.println("Source tables:");
      response.sourceImages().forEach(image -> out.println("  " + image));
    }
    response.warnings().forEach(warning -> out.println("⚠ " + warning));
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
