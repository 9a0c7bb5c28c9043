package com.tomeqa.index.config;

import com.tomeqa.index.store.IndexServiceClient;
import com.tomeqa.index.store.memory.InMemoryIndexServiceClient;
import com.tomeqa.index.store.qdrant.QdrantIndexServiceClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Selects the index service backend from {@code tomeqa.index.store.type}.
 */
@Configuration
public class IndexServiceConfig {

    // Qdrant REST API (default)
    @Bean
    @ConditionalOnProperty(name = "tomeqa.index.store.type", havingValue = "qdrant", matchIfMissing = true)
    public IndexServiceClient qdrantIndexServiceClient(
            @Value("${tomeqa.index.qdrant.base-url:http://localhost:6333}") String baseUrl,
            @Value("${tomeqa.index.qdrant.api-key:}") String apiKey,
            @Value("${tomeqa.index.qdrant.distance:Cosine}") String distance,
            @Value("${tomeqa.index.qdrant.admin-timeout:60s}") Duration adminTimeout,
            @Value("${tomeqa.index.qdrant.search-timeout:30s}") Duration searchTimeout
    ) {
        return new QdrantIndexServiceClient(baseUrl, apiKey, distance, adminTimeout, searchTimeout);
    }

    // In-process index for local runs and tests
    @Bean
    @ConditionalOnProperty(name = "tomeqa.index.store.type", havingValue = "memory")
    public IndexServiceClient inMemoryIndexServiceClient() {
        return new InMemoryIndexServiceClient();
    }
}
