package com.flamingo.ai.tablerag.service.rag.index;

import com.flamingo.ai.tablerag.exception.EmbeddingModelMismatchException;
import com.flamingo.ai.tablerag.service.rag.model.IndexNode;
import com.flamingo.ai.tablerag.service.rag.model.RetrievalResult;
import com.flamingo.ai.tablerag.service.rag.model.ScoredNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable in-memory vector index over text and table nodes.
 *
 * <p>Search is exhaustive cosine similarity. Results are sorted with a stable sort, so nodes with
 * equal scores come back in insertion order.
 */
public final class VectorIndex {

  private final IndexManifest manifest;
  private final List<IndexEntry> entries;

  public VectorIndex(IndexManifest manifest, List<IndexEntry> entries) {
    Set<String> ids = new HashSet<>();
    for (IndexEntry entry : entries) {
      if (!ids.add(entry.node().id())) {
        throw new IllegalArgumentException("Duplicate node id in index: " + entry.node().id());
      }
      if (entry.embedding().length != manifest.dimensions()) {
        throw new EmbeddingModelMismatchException(
            String.format(
                "Node %s has a %d-dimensional embedding, index expects %d",
                entry.node().id(), entry.embedding().length, manifest.dimensions()));
      }
    }
    this.manifest = manifest;
    this.entries = List.copyOf(entries);
  }

  public IndexManifest manifest() {
    return manifest;
  }

  public List<IndexEntry> entries() {
    return entries;
  }

  public List<IndexNode> nodes() {
    return entries.stream().map(IndexEntry::node).toList();
  }

  public int size() {
    return entries.size();
  }

  /**
   * Returns the {@code k} nodes most similar to the query vector.
   *
   * @throws EmbeddingModelMismatchException if the query vector has the wrong dimension
   */
  public RetrievalResult search(float[] queryEmbedding, int k) {
    if (k <= 0) {
      throw new IllegalArgumentException("k must be positive, got " + k);
    }
    if (queryEmbedding.length != manifest.dimensions()) {
      throw new EmbeddingModelMismatchException(
          String.format(
              "Query embedding has %d dimensions but the index was built with %d (%s)",
              queryEmbedding.length, manifest.dimensions(), manifest.embeddingModel()));
    }

    List<ScoredNode> scored = new ArrayList<>(entries.size());
    for (IndexEntry entry : entries) {
      scored.add(new ScoredNode(entry.node(), cosine(queryEmbedding, entry.embedding())));
    }
    scored.sort(Comparator.comparingDouble(ScoredNode::score).reversed());
    return new RetrievalResult(scored.subList(0, Math.min(k, scored.size())));
  }

  static double cosine(float[] a, float[] b) {
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
