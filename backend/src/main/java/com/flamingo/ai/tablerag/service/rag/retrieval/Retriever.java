package com.flamingo.ai.tablerag.service.rag.retrieval;

import com.flamingo.ai.tablerag.config.EmbeddingProfile;
import com.flamingo.ai.tablerag.exception.EmbeddingModelMismatchException;
import com.flamingo.ai.tablerag.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.tablerag.service.rag.index.VectorIndex;
import com.flamingo.ai.tablerag.service.rag.model.RetrievalResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Top-k semantic retrieval over a loaded {@link VectorIndex}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class Retriever {

  private final EmbeddingService embeddingService;
  private final EmbeddingProfile embeddingProfile;

  /**
   * Embeds {@code query} and returns the {@code k} most similar nodes, best first.
   *
   * @throws EmbeddingModelMismatchException if the index was built with another embedding model
   */
  public RetrievalResult retrieve(VectorIndex index, String query, int k) {
    if (!embeddingProfile.modelName().equals(index.manifest().embeddingModel())) {
      throw new EmbeddingModelMismatchException(
          "Index was built with "
              + index.manifest().embeddingModel()
              + ", queries use "
              + embeddingProfile.modelName());
    }

    float[] queryEmbedding = embeddingService.embedQuery(query);
    RetrievalResult result = index.search(queryEmbedding, k);
    log.debug(
        "Retrieved {} of {} nodes for query ({} chars), top score {}",
        result.size(),
        index.size(),
        query.length(),
        result.isEmpty() ? "n/a" : String.format("%.4f", result.hits().get(0).score()));
    return result;
  }
}
