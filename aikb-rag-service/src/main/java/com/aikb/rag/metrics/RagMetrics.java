package com.aikb.rag.metrics;

import com.aikb.rag.error.RagFailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the query pipeline and ingestion.
 * Exposed through the actuator Prometheus endpoint.
 */
@Component
public class RagMetrics {

    private final MeterRegistry registry;

    // Timers
    private final Timer embeddingTimer;
    private final Timer retrievalTimer;
    private final Timer generationTimer;
    private final Timer queryTimer;
    private final Timer ingestTimer;

    // Counters
    private final Counter queryCounter;
    private final Counter noContextCounter;
    private final Counter truncatedContextCounter;
    private final Counter auditFailureCounter;
    private final Counter documentIngestCounter;
    private final Counter chunkCreatedCounter;
    private final Map<RagFailureKind, Counter> failureCounters = new EnumMap<>(RagFailureKind.class);

    public RagMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.embeddingTimer = Timer.builder("rag.embedding.duration")
                .description("Time to embed the query text")
                .tags("stage", "embedding")
                .register(registry);

        this.retrievalTimer = Timer.builder("rag.retrieval.duration")
                .description("Time for vector similarity search")
                .tags("stage", "retrieval")
                .register(registry);

        this.generationTimer = Timer.builder("rag.generation.duration")
                .description("Time for the model to generate an answer")
                .tags("stage", "generation")
                .register(registry);

        this.queryTimer = Timer.builder("rag.query.duration")
                .description("Total RAG query duration")
                .tags("operation", "query")
                .register(registry);

        this.ingestTimer = Timer.builder("rag.ingest.duration")
                .description("Time to ingest a document")
                .tags("operation", "ingest")
                .register(registry);

        this.queryCounter = Counter.builder("rag.query.total")
                .description("Total number of completed RAG queries")
                .register(registry);

        this.noContextCounter = Counter.builder("rag.query.no.context")
                .description("Queries answered without any retrieved context")
                .register(registry);

        this.truncatedContextCounter = Counter.builder("rag.context.truncated")
                .description("Queries whose context was cut to the token ceiling")
                .register(registry);

        this.auditFailureCounter = Counter.builder("rag.audit.failures")
                .description("Audit entries that could not be written")
                .register(registry);

        this.documentIngestCounter = Counter.builder("rag.documents.ingested")
                .description("Number of documents ingested")
                .register(registry);

        this.chunkCreatedCounter = Counter.builder("rag.chunks.created")
                .description("Number of chunks created")
                .register(registry);

        for (RagFailureKind kind : RagFailureKind.values()) {
            failureCounters.put(kind, Counter.builder("rag.query.errors")
                    .description("Failed RAG queries by failure kind")
                    .tags("kind", kind.name())
                    .register(registry));
        }
    }

    public void recordEmbeddingTime(long durationMs) {
        embeddingTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordRetrievalTime(long durationMs) {
        retrievalTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordGenerationTime(long durationMs) {
        generationTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordQueryTime(long durationMs) {
        queryTimer.record(durationMs, TimeUnit.MILLISECONDS);
        queryCounter.increment();
    }

    public void recordQueryFailure(RagFailureKind kind) {
        failureCounters.get(kind).increment();
    }

    public void recordNoContext() {
        noContextCounter.increment();
    }

    public void recordTruncatedContext() {
        truncatedContextCounter.increment();
    }

    public void recordAuditFailure() {
        auditFailureCounter.increment();
    }

    public void recordLateSettlement(String stage, boolean failed) {
        registry.counter("rag.stage.late.settlements", "stage", stage, "outcome", failed ? "error" : "success")
                .increment();
    }

    public void recordIngestTime(long durationMs) {
        ingestTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordDocumentIngested(int chunkCount) {
        documentIngestCounter.increment();
        chunkCreatedCounter.increment(chunkCount);
    }

    public double lateSettlementCount(String stage) {
        return registry.find("rag.stage.late.settlements").tag("stage", stage).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    public double failureCount(RagFailureKind kind) {
        return failureCounters.get(kind).count();
    }
}
