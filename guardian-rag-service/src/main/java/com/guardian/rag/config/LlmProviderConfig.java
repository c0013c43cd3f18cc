package com.guardian.rag.config;

import com.guardian.rag.llm.ChatClient;
import com.guardian.rag.llm.EmbeddingsClient;
import com.guardian.rag.llm.EmbeddingsClientFactory;
import com.guardian.rag.llm.openai.OpenAIChatClient;
import com.guardian.rag.llm.openai.OpenAIEmbeddingsClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    // Any OpenAI-compatible /v1/embeddings server (text-embeddings-inference, vLLM, llama.cpp, OpenAI)
    @Bean
    public EmbeddingsClientFactory embeddingsClientFactory(
            @Value("${guardian.embedding.base-url}") String baseUrl,
            @Value("${guardian.embedding.api-key:}") String apiKey,
            @Value("${guardian.embedding.timeout:30s}") Duration timeout
    ) {
        return model -> new OpenAIEmbeddingsClient(baseUrl, model, apiKey, timeout);
    }

    @Bean
    public EmbeddingsClient embeddingsClient(
            EmbeddingsClientFactory factory,
            @Value("${guardian.embedding.model}") String model
    ) {
        log.info("Embedding model: {}", model);
        return factory.create(model);
    }

    // Groq by default; only created when an API key is configured
    @Bean
    @ConditionalOnExpression("!'${guardian.llm.api-key:}'.isEmpty()")
    public ChatClient chatClient(
            @Value("${guardian.llm.base-url}") String baseUrl,
            @Value("${guardian.llm.model}") String model,
            @Value("${guardian.llm.api-key}") String apiKey,
            @Value("${guardian.llm.timeout:60s}") Duration timeout
    ) {
        log.info("Chat model: {} at {}", model, baseUrl);
        return new OpenAIChatClient(baseUrl, model, apiKey, timeout);
    }
}
