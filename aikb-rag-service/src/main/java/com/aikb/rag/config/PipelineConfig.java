package com.aikb.rag.config;

import com.aikb.rag.audit.AuditSink;
import com.aikb.rag.audit.JpaAuditSink;
import com.aikb.rag.audit.LoggingAuditSink;
import com.aikb.rag.budget.BudgetController;
import com.aikb.rag.chunk.OverlappingChunker;
import com.aikb.rag.ingest.FrontMatterExtractor;
import com.aikb.rag.metrics.RagMetrics;
import com.aikb.rag.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Timed-out stage calls keep their thread until they settle, so the pool is unbounded
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService ragStageExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "rag-stage-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    public BudgetController budgetController(RagProperties properties, Clock clock,
                                             ExecutorService ragStageExecutor, RagMetrics metrics) {
        RagProperties.TimeoutConfig timeouts = properties.getTimeouts();
        return new BudgetController(clock, timeouts.getGlobalMs(), timeouts.getMinRemainingMs(),
                ragStageExecutor, metrics);
    }

    @Bean
    public OverlappingChunker overlappingChunker(RagProperties properties) {
        RagProperties.ChunkingConfig chunking = properties.getChunking();
        return new OverlappingChunker(chunking.getMaxChars(), chunking.getOverlapChars());
    }

    @Bean
    public FrontMatterExtractor frontMatterExtractor() {
        return new FrontMatterExtractor();
    }

    @Bean
    public AuditSink auditSink(RagProperties properties, AuditLogRepository repository) {
        RagProperties.AuditSinkType type = properties.getAudit().getType();
        log.info("Audit sink: {}", type);
        return switch (type) {
            case JPA -> new JpaAuditSink(repository);
            case LOG -> new LoggingAuditSink();
        };
    }
}
