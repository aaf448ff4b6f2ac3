package com.flamingo.ai.tablerag.service.rag.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Answer to one question.
 *
 * @param status outcome category
 * @param answer synthesized answer text, empty unless {@link QueryStatus#ANSWERED}
 * @param sourceImages distinct table image paths among the retrieved nodes, first-occurrence order
 * @param context the context block sent to the synthesizer (diagnostics)
 * @param warnings user-visible warnings, one per source image missing on disk
 * @param citationAudit citations found in the answer
 * @param errorMessage user-facing message for {@link QueryStatus#NOT_INGESTED} and {@link
 *     QueryStatus#FAILED}
 */
public record QueryResponse(
    QueryStatus status,
    String answer,
    List<String> sourceImages,
    String context,
    List<String> warnings,
    CitationAudit citationAudit,
    String errorMessage) {

  public QueryResponse {
    sourceImages = List.copyOf(sourceImages);
    warnings = List.copyOf(warnings);
  }

  public static QueryResponse answered(
      String answer,
      List<String> sourceImages,
      String context,
      List<String> warnings,
      CitationAudit citationAudit) {
    return new QueryResponse(
        QueryStatus.ANSWERED, answer, sourceImages, context, warnings, citationAudit, null);
  }

  public static QueryResponse notIngested(String message) {
    return new QueryResponse(
        QueryStatus.NOT_INGESTED, "", List.of(), "", List.of(), CitationAudit.empty(), message);
  }

  public static QueryResponse failed(String message, String context) {
    return new QueryResponse(
        QueryStatus.FAILED, "", List.of(), context, List.of(), CitationAudit.empty(), message);
  }

  /** Copy of this response carrying {@code extraWarnings} after any existing warnings. */
  public QueryResponse withWarnings(List<String> extraWarnings) {
    if (extraWarnings.isEmpty()) {
      return this;
    }
    List<String> merged = new ArrayList<>(warnings);
    merged.addAll(extraWarnings);
    return new QueryResponse(
        status, answer, sourceImages, context, merged, citationAudit, errorMessage);
  }

  public boolean isAnswered() {
    return status == QueryStatus.ANSWERED;
  }
}
