package com.aikb.rag.config;

import com.aikb.rag.llm.AnswerGenerator;
import com.aikb.rag.llm.EmbeddingsClient;
import com.aikb.rag.llm.mock.StubAnswerGenerator;
import com.aikb.rag.llm.mock.StubEmbeddingsClient;
import com.aikb.rag.llm.openai.OpenAIAnswerGenerator;
import com.aikb.rag.llm.openai.OpenAIEmbeddingsClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmProviderConfig {

    // Deterministic stubs (default, no network)
    @Bean
    @ConditionalOnProperty(name = "aikb.rag.llm.provider", havingValue = "mock", matchIfMissing = true)
    public EmbeddingsClient embeddingsMock(
            @Value("${aikb.rag.mock.dimension:384}") int dimension
    ) {
        return new StubEmbeddingsClient(dimension);
    }

    @Bean
    @ConditionalOnProperty(name = "aikb.rag.llm.provider", havingValue = "mock", matchIfMissing = true)
    public AnswerGenerator generatorMock() {
        return new StubAnswerGenerator();
    }

    // OpenAI-compatible API (OpenAI, llama.cpp, Ollama)
    @Bean
    @ConditionalOnProperty(name = "aikb.rag.llm.provider", havingValue = "openai")
    public EmbeddingsClient embeddingsOpenAI(
            @Value("${aikb.rag.openai.base-url}") String baseUrl,
            @Value("${aikb.rag.openai.embed-model}") String model,
            @Value("${aikb.rag.openai.api-key:}") String apiKey
    ) {
        return new OpenAIEmbeddingsClient(baseUrl, model, apiKey);
    }

    @Bean
    @ConditionalOnProperty(name = "aikb.rag.llm.provider", havingValue = "openai")
    public AnswerGenerator generatorOpenAI(
            @Value("${aikb.rag.openai.base-url}") String baseUrl,
            @Value("${aikb.rag.openai.chat-model}") String model,
            @Value("${aikb.rag.openai.api-key:}") String apiKey,
            @Value("${aikb.rag.openai.temperature:0.2}") double temperature,
            @Value("${aikb.rag.openai.max-tokens:1024}") int maxTokens
    ) {
        return new OpenAIAnswerGenerator(baseUrl, model, apiKey, temperature, maxTokens);
    }
}
