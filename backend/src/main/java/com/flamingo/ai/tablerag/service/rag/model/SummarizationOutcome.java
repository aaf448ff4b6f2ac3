package com.flamingo.ai.tablerag.service.rag.model;

/** Result of summarizing one table artifact. Failures are per-item and never abort a run. */
public sealed interface SummarizationOutcome {

  TableArtifact artifact();

  /** The vision call produced a usable summary. */
  record Summarized(TableArtifact artifact, TableNode node) implements SummarizationOutcome {}

  /** The vision call failed or returned nothing usable; the artifact gets no node. */
  record Failed(TableArtifact artifact, String reason) implements SummarizationOutcome {}
}
