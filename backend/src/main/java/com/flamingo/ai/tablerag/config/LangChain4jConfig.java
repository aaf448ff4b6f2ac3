package com.flamingo.ai.tablerag.config;

import com.flamingo.ai.tablerag.exception.MissingCredentialException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Configuration for LangChain4j models.
 *
 * <p>All models talk to one OpenAI-compatible endpoint (OpenRouter by default), authenticated with
 * the key resolved from the process environment at startup.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String apiKey;

  @Value("${langchain4j.openai.base-url:https://openrouter.ai/api/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:openai/gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:2048}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.embedding-model.model-name:openai/text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  /** Model answering questions from the assembled context. */
  @Bean
  @Primary
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(apiKey)
        .baseUrl(baseUrl)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(60))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  /**
   * Model describing table crops. Shares the chat model name but carries its own timeout so a slow
   * image request fails as a single item.
   */
  @Bean
  public ChatModel visionChatModel(RagConfig ragConfig) {
    validateApiKey();

    RagConfig.Summarization summarization = ragConfig.getSummarization();
    return OpenAiChatModel.builder()
        .apiKey(apiKey)
        .baseUrl(baseUrl)
        .modelName(chatModelName)
        .maxCompletionTokens(summarization.getMaxCompletionTokens())
        .timeout(Duration.ofSeconds(summarization.getTimeoutSeconds()))
        .maxRetries(0)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(apiKey)
        .baseUrl(baseUrl)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  @Bean
  public EmbeddingProfile embeddingProfile() {
    return new EmbeddingProfile(embeddingModelName, embeddingDimensions);
  }

  private void validateApiKey() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new MissingCredentialException(
          "Model provider API key is required. Set OPENROUTER_API_KEY or OPENAI_API_KEY.");
    }
  }
}
