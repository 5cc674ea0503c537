package com.flamingo.ai.ephemeralrag.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the embedding model. Any OpenAI-compatible endpoint works, including a local
 * server hosting a sentence-transformers model, as long as it returns vectors of the configured
 * dimension.
 */
@Configuration
@RequiredArgsConstructor
public class LangChain4jConfig {

  private final RagConfig ragConfig;

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Bean
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    RagConfig.Embedding embedding = ragConfig.getEmbedding();
    OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder =
        OpenAiEmbeddingModel.builder()
            .apiKey(openAiApiKey)
            .modelName(embedding.getModelName())
            .dimensions(embedding.getDimension())
            .timeout(embedding.getTimeout())
            .maxRetries(0)
            .logRequests(false)
            .logResponses(false);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    return builder.build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
