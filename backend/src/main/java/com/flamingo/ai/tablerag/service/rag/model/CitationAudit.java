package com.flamingo.ai.tablerag.service.rag.model;

import java.util.List;

/**
 * What an answer cites compared with what was retrieved. Diagnostic only.
 *
 * @param citedPages page numbers cited in the answer, in order of first mention
 * @param citedTables table file names cited in the answer, in order of first mention
 * @param unmatchedCitations citations that point at no retrieved node
 */
public record CitationAudit(
    List<Integer> citedPages, List<String> citedTables, List<String> unmatchedCitations) {

  public CitationAudit {
    citedPages = List.copyOf(citedPages);
    citedTables = List.copyOf(citedTables);
    unmatchedCitations = List.copyOf(unmatchedCitations);
  }

  public static CitationAudit empty() {
    return new CitationAudit(List.of(), List.of(), List.of());
  }

  public boolean hasCitations() {
    return !citedPages.isEmpty() || !citedTables.isEmpty();
  }
}
