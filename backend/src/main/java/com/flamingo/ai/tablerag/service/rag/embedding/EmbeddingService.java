package com.flamingo.ai.tablerag.service.rag.embedding;

import com.flamingo.ai.tablerag.exception.LlmServiceException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Service for generating text embeddings with the configured embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; financial text runs ~4 chars/token, so this stays
  // well below the limit
  static final int MAX_CHARS_PER_EMBEDDING = 8000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /** Embeds a user question. */
  @Retry(name = "openai")
  public float[] embedQuery(String query) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      float[] vector = embedOne(truncate(query, "(query)"));
      meterRegistry.counter("embedding.requests.success", "type", "query").increment();
      return vector;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration", "type", "query"));
    }
  }

  /** Embeds one node text. Callers embed node by node, so a retry repeats only this call. */
  @Retry(name = "openai")
  public float[] embedPassage(String passage) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      float[] vector = embedOne(truncate(passage, "(passage)"));
      meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
      return vector;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration", "type", "passage"));
    }
  }

  private float[] embedOne(String text) {
    Response<Embedding> response;
    try {
      response = embeddingModel.embed(text);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new LlmServiceException("Embedding request failed: " + e.getMessage(), e);
    }
    if (response == null || response.content() == null) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new LlmServiceException("Embedding model returned no vector");
    }
    return response.content().vector();
  }

  private String truncate(String text, String label) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        label,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }
}
