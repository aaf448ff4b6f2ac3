package com.flamingo.ai.tablerag.service.rag.model;

import java.util.List;

/**
 * Top-k hits for one query, ordered by descending score. Equal scores keep index insertion order.
 */
public record RetrievalResult(List<ScoredNode> hits) {

  public RetrievalResult {
    hits = List.copyOf(hits);
  }

  public static RetrievalResult empty() {
    return new RetrievalResult(List.of());
  }

  public List<IndexNode> nodes() {
    return hits.stream().map(ScoredNode::node).toList();
  }

  public int size() {
    return hits.size();
  }

  public boolean isEmpty() {
    return hits.isEmpty();
  }
}
