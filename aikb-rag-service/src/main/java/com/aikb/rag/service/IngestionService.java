package com.aikb.rag.service;

import com.aikb.rag.chunk.Chunk;
import com.aikb.rag.chunk.OverlappingChunker;
import com.aikb.rag.config.RagProperties;
import com.aikb.rag.error.ValidationException;
import com.aikb.rag.ingest.DocumentMetadata;
import com.aikb.rag.ingest.FrontMatterExtractor;
import com.aikb.rag.llm.EmbeddingsClient;
import com.aikb.rag.metrics.RagMetrics;
import com.aikb.rag.redact.PiiRedactor;
import com.aikb.rag.store.KnowledgeStore;
import com.aikb.rag.store.StoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Semaphore;
import java.util.stream.Collectors;

/**
 * Front matter, redaction, chunking, embedding and storage of one document. A
 * re-ingested document replaces all of its previous chunks.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final FrontMatterExtractor extractor;
    private final OverlappingChunker chunker;
    private final EmbeddingsClient embed;
    private final KnowledgeStore store;
    private final PiiRedactor redactor;
    private final RagMetrics metrics;
    private final Clock clock;

    private final Set<String> sensitiveLevels;
    private final Semaphore embedPermits;

    private volatile boolean loggedEmbeddingDim = false;

    public IngestionService(FrontMatterExtractor extractor,
                            OverlappingChunker chunker,
                            EmbeddingsClient embed,
                            KnowledgeStore store,
                            PiiRedactor redactor,
                            RagMetrics metrics,
                            RagProperties properties,
                            Clock clock) {
        this.extractor = extractor;
        this.chunker = chunker;
        this.embed = embed;
        this.store = store;
        this.redactor = redactor;
        this.metrics = metrics;
        this.clock = clock;
        this.sensitiveLevels = properties.getRedaction().getSensitiveLevels().stream()
                .map(s -> s.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.embedPermits = new Semaphore(Math.max(1, properties.getChunking().getMaxConcurrentEmbeddings()));
    }

    /**
     * @param docId document id; when blank the {@code document_id} from the front matter is used
     * @param title display title; falls back to the front-matter title, then to the id
     */
    public IngestResult ingest(String docId, String rawText, String title) {
        long ingestStart = System.currentTimeMillis();

        FrontMatterExtractor.Extraction extraction = extractor.extract(rawText);
        DocumentMetadata metadata = extraction.metadata();

        String id = firstNonBlank(docId, metadata.documentId());
        if (id == null) {
            throw new ValidationException("docId is required when the document has no document_id");
        }
        String resolvedTitle = firstNonBlank(title, metadata.title(), id);
        String sensitivity = metadata.sensitivityOrDefault();

        String body = applyRedactionRules(extraction.body(), metadata, sensitivity);
        List<Chunk> chunks = chunker.chunkDocument(id, body);
        if (chunks.isEmpty()) {
            throw new ValidationException("Document " + id + " has no content to index");
        }

        List<Chunk> embedded = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            embedPermits.acquireUninterruptibly();
            try {
                List<Double> vec = embed.embed(chunk.text());
                if (!loggedEmbeddingDim) {
                    loggedEmbeddingDim = true;
                    log.info("[INGEST] Detected embedding dimension={}", vec.size());
                }
                if (vec.size() <= 1) {
                    throw new IllegalStateException("Embedding vector looks wrong (dim=" + vec.size()
                            + "). Check embedding server response parsing.");
                }
                embedded.add(chunk.withEmbedding(vec));
            } finally {
                embedPermits.release();
            }
        }

        StoredDocument document = new StoredDocument(
                id, resolvedTitle, metadata.category(), metadata.department(), sensitivity,
                embedded.size(), clock.instant());
        store.replaceDocument(document, embedded);

        long ingestTime = System.currentTimeMillis() - ingestStart;
        metrics.recordIngestTime(ingestTime);
        metrics.recordDocumentIngested(embedded.size());
        log.info("[TIMING] Document ingest: {}ms for {} chunks (docId={}, sensitivity={})",
                ingestTime, embedded.size(), id, sensitivity);

        return new IngestResult(id, resolvedTitle, embedded.size(), sensitivity);
    }

    public void delete(String docId) {
        if (docId == null || docId.isBlank()) {
            throw new ValidationException("docId is required");
        }
        store.deleteDocument(docId);
    }

    public List<StoredDocument> listDocuments() {
        return store.getAllMetadata();
    }

    String applyRedactionRules(String body, DocumentMetadata metadata, String sensitivity) {
        String out = redactor.redactFields(body, metadata.redactFields());
        if (sensitiveLevels.contains(sensitivity)) {
            out = redactor.redactPii(out);
            log.info("[INGEST] Applied PII redaction for sensitivity {}", sensitivity);
        }
        return out;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }
}
