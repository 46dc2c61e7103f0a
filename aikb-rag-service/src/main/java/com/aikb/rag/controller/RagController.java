package com.aikb.rag.controller;

import com.aikb.rag.dto.HealthResponse;
import com.aikb.rag.dto.IngestRequest;
import com.aikb.rag.dto.IngestResponse;
import com.aikb.rag.dto.QueryResponse;
import com.aikb.rag.model.AnswerResult;
import com.aikb.rag.model.QueryRequest;
import com.aikb.rag.service.IngestResult;
import com.aikb.rag.service.IngestionService;
import com.aikb.rag.service.RagOrchestrator;
import com.aikb.rag.store.KnowledgeStore;
import com.aikb.rag.store.StoredDocument;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/rag")
@Tag(name = "Knowledge Base", description = "Grounded question answering and document ingestion")
public class RagController {

    private final RagOrchestrator orchestrator;
    private final IngestionService ingestionService;
    private final KnowledgeStore store;

    public RagController(RagOrchestrator orchestrator, IngestionService ingestionService, KnowledgeStore store) {
        this.orchestrator = orchestrator;
        this.ingestionService = ingestionService;
        this.store = store;
    }

    /**
     * Failures surface as {@code RagQueryException} and are mapped by {@link RagExceptionHandler}.
     */
    @PostMapping("/query")
    @Operation(summary = "Answer a question from the knowledge base with cited sources")
    public ResponseEntity<QueryResponse> query(@RequestBody QueryRequest request) {
        AnswerResult result = orchestrator.query(request);
        return ResponseEntity.ok(QueryResponse.from(result));
    }

    @PostMapping("/documents")
    @Operation(summary = "Ingest or re-ingest a document")
    public ResponseEntity<IngestResponse> ingest(@RequestBody IngestRequest request) {
        request.validate();
        IngestResult result = ingestionService.ingest(request.docId(), request.text(), request.title());
        return ResponseEntity.status(HttpStatus.CREATED).body(IngestResponse.success(result));
    }

    @GetMapping("/documents")
    @Operation(summary = "List ingested documents")
    public List<StoredDocument> documents() {
        return ingestionService.listDocuments();
    }

    @DeleteMapping("/documents/{docId}")
    @Operation(summary = "Delete a document and all of its chunks")
    public ResponseEntity<Void> delete(@PathVariable String docId) {
        ingestionService.delete(docId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    @Operation(summary = "Check knowledge store availability")
    public ResponseEntity<HealthResponse> health() {
        try {
            return ResponseEntity.ok(HealthResponse.healthy(store.getVectorCount()));
        } catch (RuntimeException e) {
            log.warn("[RAG API] Health check failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(HealthResponse.unhealthy("Knowledge store unavailable"));
        }
    }
}
