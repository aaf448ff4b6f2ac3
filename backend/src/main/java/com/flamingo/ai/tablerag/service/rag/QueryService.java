package com.flamingo.ai.tablerag.service.rag;

import com.flamingo.ai.tablerag.config.RagConfig;
import com.flamingo.ai.tablerag.exception.IndexNotFoundException;
import com.flamingo.ai.tablerag.exception.LlmServiceException;
import com.flamingo.ai.tablerag.service.rag.answer.AnswerSynthesizer;
import com.flamingo.ai.tablerag.service.rag.answer.ContextAssembler;
import com.flamingo.ai.tablerag.service.rag.index.IndexStore;
import com.flamingo.ai.tablerag.service.rag.index.VectorIndex;
import com.flamingo.ai.tablerag.service.rag.model.QueryResponse;
import com.flamingo.ai.tablerag.service.rag.model.RetrievalResult;
import com.flamingo.ai.tablerag.service.rag.retrieval.Retriever;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers one question against the persisted index: load, retrieve, assemble, synthesize.
 *
 * <p>A missing index and a provider failure, during query embedding or synthesis, come back as
 * structured responses. A corrupted index
 * or an embedding model mismatch propagate as exceptions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryService {

  private final IndexStore indexStore;
  private final Retriever retriever;
  private final AnswerSynthesizer answerSynthesizer;
  private final ContextAssembler contextAssembler;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Timed(value = "query.duration", description = "Time to answer one question")
  public QueryResponse query(String question) {
    return query(question, Path.of(ragConfig.getStorage().getIndexDir()));
  }

  public QueryResponse query(String question, Path indexDir) {
    VectorIndex index;
    try {
      index = indexStore.load(indexDir);
    } catch (IndexNotFoundException e) {
      log.warn("Query rejected, no index at {}", e.getIndexDir());
      meterRegistry.counter("query.requests", "status", "not_ingested").increment();
      return QueryResponse.notIngested(e.getUserMessage());
    }

    RetrievalResult result;
    try {
      result = retriever.retrieve(index, question, ragConfig.getRetrieval().getTopK());
    } catch (LlmServiceException e) {
      log.error("Query embedding failed: {}", e.getMessage());
      meterRegistry.counter("query.requests", "status", "failed").increment();
      return QueryResponse.failed(e.getUserMessage(), "");
    }
    log.info("Retrieved {} nodes for question", result.size());

    QueryResponse response;
    try {
      response = answerSynthesizer.answer(question, result);
    } catch (LlmServiceException e) {
      log.error("Synthesis failed: {}", e.getMessage());
      meterRegistry.counter("query.requests", "status", "failed").increment();
      return QueryResponse.failed(e.getUserMessage(), contextAssembler.assemble(result).text());
    }

    meterRegistry.counter("query.requests", "status", "answered").increment();
    return response.withWarnings(missingImageWarnings(response.sourceImages()));
  }

  private List<String> missingImageWarnings(List<String> sourceImages) {
    List<String> warnings = new ArrayList<>();
    for (String image : sourceImages) {
      if (!Files.exists(Path.of(image))) {
        log.warn("Cited table image missing on disk: {}", image);
        warnings.add("Image not found: " + image);
      }
    }
    return warnings;
  }
}
