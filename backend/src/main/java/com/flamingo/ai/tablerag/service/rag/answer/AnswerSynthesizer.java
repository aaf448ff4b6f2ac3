package com.flamingo.ai.tablerag.service.rag.answer;

import com.flamingo.ai.tablerag.agent.FinancialAnswerAgent;
import com.flamingo.ai.tablerag.exception.LlmServiceException;
import com.flamingo.ai.tablerag.service.rag.model.AssembledContext;
import com.flamingo.ai.tablerag.service.rag.model.CitationAudit;
import com.flamingo.ai.tablerag.service.rag.model.QueryResponse;
import com.flamingo.ai.tablerag.service.rag.model.RetrievalResult;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Issues the single synthesis call for a question. Citation fidelity is requested in the agent's
 * system message; nothing here re-ranks, filters or rewrites the retrieved nodes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerSynthesizer {

  private final FinancialAnswerAgent answerAgent;
  private final ContextAssembler contextAssembler;
  private final CitationAuditor citationAuditor;
  private final MeterRegistry meterRegistry;

  /**
   * Answers {@code question} from the retrieved nodes.
   *
   * @return an answered response carrying the retrieved table images verbatim
   * @throws LlmServiceException if the provider fails or returns nothing
   */
  @Retry(name = "openai")
  public QueryResponse answer(String question, RetrievalResult result) {
    AssembledContext context = contextAssembler.assemble(result);
    String answer = synthesize(question, context.text());
    CitationAudit audit = citationAuditor.audit(answer, result);
    return QueryResponse.answered(answer, context.sourceImages(), context.text(), List.of(), audit);
  }

  private String synthesize(String question, String context) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      String answer = answerAgent.answer(context, question);
      if (answer == null || answer.isBlank()) {
        throw new LlmServiceException("Language model returned an empty answer");
      }
      meterRegistry.counter("synthesis.requests.success").increment();
      return answer.strip();
    } catch (LlmServiceException e) {
      meterRegistry.counter("synthesis.requests.failure").increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("synthesis.requests.failure").increment();
      log.error("Answer synthesis failed: {}", e.getMessage());
      throw new LlmServiceException("Answer synthesis failed: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer("synthesis.duration"));
    }
  }
}
