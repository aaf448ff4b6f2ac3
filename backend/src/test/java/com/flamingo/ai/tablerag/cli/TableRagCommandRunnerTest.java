package com.flamingo.ai.tablerag.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.tablerag.service.rag.IngestionService;
import com.flamingo.ai.tablerag.service.rag.QueryService;
import com.flamingo.ai.tablerag.service.rag.model.CitationAudit;
import com.flamingo.ai.tablerag.service.rag.model.IngestReport;
import com.flamingo.ai.tablerag.service.rag.model.QueryResponse;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
@DisplayName("TableRagCommandRunner Tests")
class TableRagCommandRunnerTest {

  @Mock private ObjectProvider<IngestionService> ingestionProvider;
  @Mock private ObjectProvider<QueryService> queryProvider;
  @Mock private IngestionService ingestionService;
  @Mock private QueryService queryService;

  private ByteArrayOutputStream output;
  private TableRagCommandRunner runner;

  @BeforeEach
  void setUp() {
    output = new ByteArrayOutputStream();
    runner =
        new TableRagCommandRunner(
            ingestionProvider,
            queryProvider,
            new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  private String printed() {
    return output.toString(StandardCharsets.UTF_8);
  }

  @Test
  @DisplayName("Should print the ingest report")
  void shouldPrintIngestReport() {
    when(ingestionProvider.getObject()).thenReturn(ingestionService);
    when(ingestionService.ingest())
        .thenReturn(new IngestReport(12, 40, 3, 2, 1, Path.of("./storage")));

    runner.run(new DefaultApplicationArguments("--ingest"));

    assertThat(printed()).contains("Ingested 12 pages").contains("2 of 3 tables summarized");
    assertThat(runner.getExitCode()).isZero();
  }

  @Test
  @DisplayName("Should print the answer and the no-tables notice")
  void shouldPrintAnswerWithoutTables() {
    when(queryProvider.getObject()).thenReturn(queryService);
    when(queryService.query("What was revenue?"))
        .thenReturn(
            QueryResponse.answered(
                "Revenue was 4.2bn (Page 3).", List.of(), "ctx", List.of(), CitationAudit.empty()));

    runner.run(new DefaultApplicationArguments("--query=What was revenue?"));

    assertThat(printed())
        .contains("Revenue was 4.2bn (Page 3).")
        .contains("No visual tables cited for this answer.");
    verifyNoInteractions(ingestionProvider);
  }

  @Test
  @DisplayName("Should list source tables and missing-image warnings")
  void shouldPrintSourceTablesAndWarnings() {
    when(queryProvider.getObject()).thenReturn(queryService);
    when(queryService.query("Costs?"))
        .thenReturn(
            QueryResponse.answered(
                "Costs fell (p2_table_0.png).",
                List.of("/data/p2_table_0.png"),
                "ctx",
                List.of("Image not found: /data/p2_table_0.png"),
                CitationAudit.empty()));

    runner.run(new DefaultApplicationArguments("--query=Costs?"));

    assertThat(printed())
        .contains("Source tables:")
        .contains("/data/p2_table_0.png")
        .contains("Image not found: /data/p2_table_0.png")
        .doesNotContain("No visual tables cited");
  }

  @Test
  @DisplayName("Should print the not-ingested message and exit non-zero")
  void shouldReportNotIngested() {
    when(queryProvider.getObject()).thenReturn(queryService);
    when(queryService.query("Revenue?"))
        .thenReturn(QueryResponse.notIngested("Database not found. Run the ingest command first."));

    runner.run(new DefaultApplicationArguments("--query=Revenue?"));

    assertThat(printed()).contains("❌ Database not found. Run the ingest command first.");
    assertThat(runner.getExitCode()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should do nothing in app mode")
  void shouldDoNothingInAppMode() {
    runner.run(new DefaultApplicationArguments("--app"));

    assertThat(printed()).isEmpty();
    verifyNoInteractions(ingestionProvider, queryProvider);
  }
}
