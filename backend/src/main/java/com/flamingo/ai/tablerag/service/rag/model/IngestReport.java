package com.flamingo.ai.tablerag.service.rag.model;

import java.nio.file.Path;

/**
 * Summary of a finished ingest run.
 *
 * @param pageCount pages in the report
 * @param textNodes text chunks indexed
 * @param tableArtifacts table crops written to disk
 * @param tableNodes table summaries indexed
 * @param failedSummaries table crops dropped because summarization failed
 * @param indexDir directory holding the persisted index
 */
public record IngestReport(
    int pageCount,
    int textNodes,
    int tableArtifacts,
    int tableNodes,
    int failedSummaries,
    Path indexDir) {

  public int totalNodes() {
    return textNodes + tableNodes;
  }
}
