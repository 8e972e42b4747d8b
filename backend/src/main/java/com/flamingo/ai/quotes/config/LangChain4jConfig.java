package com.flamingo.ai.quotes.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j chat models behind the author classifier and the quote scorer.
 *
 * <p>Both models sample deterministically and do not retry on their own; retries are owned by
 * {@link com.flamingo.ai.quotes.agent.ClassificationRetryPolicy}.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.classifier-model.model-name:gpt-4.1-mini}")
  private String classifierModelName;

  @Value("${langchain4j.openai.classifier-model.max-completion-tokens:32}")
  private int classifierMaxCompletionTokens;

  @Value("${langchain4j.openai.scorer-model.model-name:gpt-4.1-mini}")
  private String scorerModelName;

  @Value("${langchain4j.openai.scorer-model.max-completion-tokens:1024}")
  private int scorerMaxCompletionTokens;

  @Value("${langchain4j.openai.timeout:60s}")
  private Duration timeout;

  @Bean
  public ChatModel classifierChatModel() {
    return deterministicChatModel(classifierModelName, classifierMaxCompletionTokens);
  }

  @Bean
  public ChatModel scorerChatModel() {
    return deterministicChatModel(scorerModelName, scorerMaxCompletionTokens);
  }

  private ChatModel deterministicChatModel(String modelName, int maxCompletionTokens) {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(modelName)
        .maxCompletionTokens(maxCompletionTokens)
        .temperature(0.0)
        .topP(1.0)
        .frequencyPenalty(0.0)
        .presencePenalty(0.0)
        .store(false)
        .strictJsonSchema(true)
        .maxRetries(0)
        .timeout(timeout)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
