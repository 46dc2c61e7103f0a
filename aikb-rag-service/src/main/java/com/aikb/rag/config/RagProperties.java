package com.aikb.rag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "aikb.rag")
public class RagProperties {

    private TimeoutConfig timeouts = new TimeoutConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private QueryConfig query = new QueryConfig();
    private RedactionConfig redaction = new RedactionConfig();
    private AuditConfig audit = new AuditConfig();

    @Data
    public static class TimeoutConfig {
        // Whole-request budget; also the upper bound of any remaining-budget computation
        private long globalMs = 60_000;
        private long embeddingMs = 30_000;
        private long retrievalMs = 15_000;
        private long generationMs = 60_000;
        private long minRemainingMs = 100;
    }

    @Data
    public static class RetrievalConfig {
        private int topK = 10;
        private double minSimilarity = 0.60;
        private int tokenCeiling = 25_000;
    }

    @Data
    public static class ChunkingConfig {
        private int maxChars = 1000;
        private int overlapChars = 200;
        private int maxConcurrentEmbeddings = 4;
    }

    @Data
    public static class QueryConfig {
        private int maxLength = 4000;
    }

    @Data
    public static class RedactionConfig {
        private boolean redactContext = true;
        private List<String> sensitiveLevels = new ArrayList<>(List.of("CONFIDENTIAL", "RESTRICTED", "EXECUTIVE"));
    }

    @Data
    public static class AuditConfig {
        private AuditSinkType type = AuditSinkType.JPA;
        private double costPerThousandTokens = 0.0005;
    }

    public enum AuditSinkType {
        JPA,
        LOG
    }
}
