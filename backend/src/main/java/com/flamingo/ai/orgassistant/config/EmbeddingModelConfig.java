package com.flamingo.ai.orgassistant.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j embedding model behind the active embedding provider. */
@Configuration
public class EmbeddingModelConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.timeout-seconds:30}")
  private int timeoutSeconds;

  @Bean
  @ConditionalOnProperty(
      name = "rag.embedding.provider",
      havingValue = "local",
      matchIfMissing = true)
  public EmbeddingModel localEmbeddingModel() {
    return new BgeSmallEnV15QuantizedEmbeddingModel();
  }

  @Bean
  @ConditionalOnProperty(name = "rag.embedding.provider", havingValue = "remote")
  public EmbeddingModel remoteEmbeddingModel(RagConfig ragConfig) {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(ragConfig.getEmbedding().getRemote().getDimensions())
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for the remote embedding provider. Set OPENAI_API_KEY"
              + " environment variable.");
    }
  }
}
