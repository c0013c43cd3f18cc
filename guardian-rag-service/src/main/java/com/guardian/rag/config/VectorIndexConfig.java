package com.guardian.rag.config;

import com.guardian.rag.index.InMemoryVectorIndex;
import com.guardian.rag.index.VectorIndex;
import com.guardian.rag.qdrant.QdrantVectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class VectorIndexConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorIndexConfig.class);

    @Bean
    @ConditionalOnProperty(name = "guardian.index.provider", havingValue = "qdrant", matchIfMissing = true)
    public VectorIndex qdrantVectorIndex(
            @Value("${guardian.qdrant.base-url}") String baseUrl,
            @Value("${guardian.qdrant.api-key:}") String apiKey,
            @Value("${guardian.qdrant.timeout:30s}") Duration timeout
    ) {
        log.info("Vector index: Qdrant at {}", baseUrl);
        return new QdrantVectorIndex(baseUrl, apiKey, timeout);
    }

    @Bean
    @ConditionalOnProperty(name = "guardian.index.provider", havingValue = "memory")
    public VectorIndex inMemoryVectorIndex() {
        log.warn("Vector index: in-memory, contents are lost on shutdown");
        return new InMemoryVectorIndex();
    }
}
