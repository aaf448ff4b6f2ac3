package com.flamingo.ai.tablerag.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent answering questions about a financial report from retrieved context.
 *
 * <p>The context mixes report text and summaries of table images, each under a source header. The
 * agent must cite a page number or table file for every fact.
 */
public interface FinancialAnswerAgent {

  @SystemMessage(
      """
        You are a financial analyst assistant.
        Answer the user's question based ONLY on the context provided below.
        The context includes text from the report and summaries of data tables.
        Crucially, cite the Page Number (e.g., 'Page 22') or Table filename
        (e.g., 'p5_table_3.png') for every fact you state.
        If the context does not contain the answer, say so.
        """)
  @UserMessage(
      """
        Context:
        {{context}}

        User Question: {{question}}
        Answer:
        """)
  String answer(@V("context") String context, @V("question") String question);
}
