package com.aikb.rag.config;

import com.aikb.rag.qdrant.QdrantClient;
import com.aikb.rag.store.InMemoryKnowledgeStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Each backend is registered once under its concrete type, which serves both as the
 * writable {@code KnowledgeStore} and the query-side {@code SimilarityRetriever}.
 */
@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(name = "aikb.rag.store.type", havingValue = "memory", matchIfMissing = true)
    public InMemoryKnowledgeStore inMemoryKnowledgeStore() {
        return new InMemoryKnowledgeStore();
    }

    @Bean
    @ConditionalOnProperty(name = "aikb.rag.store.type", havingValue = "qdrant")
    public QdrantClient qdrantKnowledgeStore(
            @Value("${aikb.rag.qdrant.base-url}") String baseUrl,
            @Value("${aikb.rag.qdrant.collection}") String collection,
            @Value("${aikb.rag.qdrant.vector-size}") int vectorSize,
            @Value("${aikb.rag.qdrant.distance:Cosine}") String distance,
            @Value("${aikb.rag.qdrant.batch-size:64}") int batchSize
    ) {
        return new QdrantClient(baseUrl, collection, vectorSize, distance, batchSize);
    }
}
