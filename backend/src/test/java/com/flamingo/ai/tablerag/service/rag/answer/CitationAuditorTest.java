package com.flamingo.ai.tablerag.service.rag.answer;

import static com.flamingo.ai.tablerag.support.TestNodes.table;
import static com.flamingo.ai.tablerag.support.TestNodes.text;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.tablerag.service.rag.model.CitationAudit;
import com.flamingo.ai.tablerag.service.rag.model.RetrievalResult;
import com.flamingo.ai.tablerag.service.rag.model.ScoredNode;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CitationAuditor Tests")
class CitationAuditorTest {

  private final CitationAuditor auditor = new CitationAuditor();
  private RetrievalResult result;

  @BeforeEach
  void setUp() {
    result =
        new RetrievalResult(
            List.of(
                new ScoredNode(text("text-p22-0", "Net income was 3.1bn", 22), 0.9),
                new ScoredNode(table("p5_table_3.png", "Operating costs", 5), 0.8)));
  }

  @Test
  @DisplayName("Should collect page and table citations that match retrieved nodes")
  void shouldCollectMatchingCitations() {
    CitationAudit audit =
        auditor.audit("Net income was 3.1bn (Page 22). Costs are in p5_table_3.png.", result);

    assertThat(audit.citedPages()).containsExactly(22);
    assertThat(audit.citedTables()).containsExactly("p5_table_3.png");
    assertThat(audit.unmatchedCitations()).isEmpty();
    assertThat(audit.hasCitations()).isTrue();
  }

  @Test
  @DisplayName("Should report citations that no retrieved node backs")
  void shouldReportUnmatchedCitations() {
    CitationAudit audit = auditor.audit("See Page 40 and p9_table_0.png; also page 22.", result);

    assertThat(audit.citedPages()).containsExactly(40, 22);
    assertThat(audit.unmatchedCitations()).containsExactly("Page 40", "p9_table_0.png");
  }

  @Test
  @DisplayName("Should report an answer without citations")
  void shouldReportMissingCitations() {
    CitationAudit audit = auditor.audit("Revenue increased.", result);

    assertThat(audit.hasCitations()).isFalse();
    assertThat(audit.unmatchedCitations()).isEmpty();
  }

  @Test
  @DisplayName("Should return an empty audit for a blank answer")
  void shouldHandleBlankAnswer() {
    assertThat(auditor.audit("", result)).isEqualTo(CitationAudit.empty());
  }
}
