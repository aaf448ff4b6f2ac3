package com.flamingo.ai.tablerag.config;

import com.flamingo.ai.tablerag.agent.FinancialAnswerAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public FinancialAnswerAgent financialAnswerAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(FinancialAnswerAgent.class).chatModel(chatModel).build();
  }
}
