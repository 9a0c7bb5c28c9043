package com.tomeqa.index.config;

import com.tomeqa.index.embed.EmbeddingsClient;
import com.tomeqa.index.embed.openai.OpenAIEmbeddingsClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LlmProviderConfig {

    // llama.cpp with OpenAI-compatible API (default)
    @Bean
    @ConditionalOnProperty(name = "tomeqa.index.llm.provider", havingValue = "llamacpp-openai", matchIfMissing = true)
    public EmbeddingsClient embeddingsLlamaCppOpenAI(
            @Value("${tomeqa.index.llama.base-url:http://localhost:8081}") String baseUrl,
            @Value("${tomeqa.index.llama.embed-model:nomic-embed-text}") String model,
            @Value("${tomeqa.index.embeddings.timeout:60s}") Duration timeout
    ) {
        return new OpenAIEmbeddingsClient(baseUrl, model, null, timeout);
    }

    // Ollama OpenAI-compatible API
    @Bean
    @ConditionalOnProperty(name = "tomeqa.index.llm.provider", havingValue = "ollama-openai")
    public EmbeddingsClient embeddingsOllamaOpenAI(
            @Value("${tomeqa.index.ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${tomeqa.index.ollama.embed-model:nomic-embed-text}") String model,
            @Value("${tomeqa.index.embeddings.timeout:60s}") Duration timeout
    ) {
        return new OpenAIEmbeddingsClient(baseUrl, model, null, timeout);
    }

    // Hosted OpenAI
    @Bean
    @ConditionalOnProperty(name = "tomeqa.index.llm.provider", havingValue = "openai")
    public EmbeddingsClient embeddingsOpenAI(
            @Value("${tomeqa.index.openai.base-url:https://api.openai.com}") String baseUrl,
            @Value("${tomeqa.index.openai.embed-model:text-embedding-3-small}") String model,
            @Value("${tomeqa.index.openai.api-key:}") String apiKey,
            @Value("${tomeqa.index.embeddings.timeout:60s}") Duration timeout
    ) {
        return new OpenAIEmbeddingsClient(baseUrl, model, apiKey, timeout);
    }
}
