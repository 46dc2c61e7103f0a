package com.aikb.rag.service;

import com.aikb.rag.chunk.OverlappingChunker;
import com.aikb.rag.config.RagProperties;
import com.aikb.rag.error.ValidationException;
import com.aikb.rag.ingest.FrontMatterExtractor;
import com.aikb.rag.llm.mock.StubEmbeddingsClient;
import com.aikb.rag.metrics.RagMetrics;
import com.aikb.rag.model.RetrievedMatch;
import com.aikb.rag.redact.PiiRedactor;
import com.aikb.rag.store.InMemoryKnowledgeStore;
import com.aikb.rag.store.StoredDocument;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private StubEmbeddingsClient embeddings;
    private InMemoryKnowledgeStore store;
    private SimpleMeterRegistry registry;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        embeddings = new StubEmbeddingsClient(64);
        store = new InMemoryKnowledgeStore();
        registry = new SimpleMeterRegistry();
        service = new IngestionService(
                new FrontMatterExtractor(),
                new OverlappingChunker(120, 20),
                embeddings,
                store,
                new PiiRedactor(),
                new RagMetrics(registry),
                new RagProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private List<String> storedTexts() {
        return store.search(embeddings.embed("anything"), 1_000).stream().map(RetrievedMatch::text).toList();
    }

    @Nested
    @DisplayName("Metadata and redaction")
    class MetadataAndRedaction {

        @Test
        @DisplayName("Should take id, title and sensitivity from front matter")
        void shouldUseFrontMatter() {
            IngestResult result = service.ingest(null, """
                    ---
                    document_id: HR-009
                    title: Compensation Bands
                    sensitivity: Confidential
                    department: People
                    ai_access:
                      redact_fields: [salary]
                    ---
                    Salary: 120000
                    Questions go to comp-team@example.com.""", null);

            assertThat(result.docId()).isEqualTo("HR-009");
            assertThat(result.title()).isEqualTo("Compensation Bands");
            assertThat(result.sensitivity()).isEqualTo("CONFIDENTIAL");
            assertThat(result.chunkCount()).isEqualTo(1);

            assertThat(storedTexts()).singleElement().satisfies(text -> {
                assertThat(text).contains("salary: [REDACTED]").doesNotContain("120000");
                assertThat(text).contains("[EMAIL REDACTED]").doesNotContain("comp-team@example.com");
            });
            assertThat(store.getAllMetadata()).singleElement().satisfies(doc -> {
                assertThat(doc.department()).isEqualTo("People");
                assertThat(doc.ingestedAt()).isEqualTo(NOW);
            });
        }

        @Test
        @DisplayName("Should keep PII in documents below the sensitive levels")
        void shouldKeepPiiForInternalDocuments() {
            service.ingest("IT-1", "Contact helpdesk@example.com for laptop issues.", "Helpdesk");

            assertThat(storedTexts()).hasSize(1);
            assertThat(storedTexts().get(0)).contains("helpdesk@example.com");
        }

        @Test
        @DisplayName("Should prefer explicit id and title over front matter")
        void shouldPreferExplicitArguments() {
            IngestResult result = service.ingest("explicit-id",
                    "---\ndocument_id: from-header\ntitle: Header Title\n---\nBody text.", "Explicit Title");

            assertThat(result.docId()).isEqualTo("explicit-id");
            assertThat(result.title()).isEqualTo("Explicit Title");
            assertThat(result.sensitivity()).isEqualTo("INTERNAL");
        }
    }

    @Nested
    @DisplayName("Re-ingestion")
    class ReIngestion {

        @Test
        @DisplayName("Should replace all previous chunks of a document")
        void shouldReplacePreviousChunks() {
            String longText = "Travel must be booked through the portal. ".repeat(20);
            IngestResult first = service.ingest("TRV-1", longText, "Travel");
            assertThat(first.chunkCount()).isGreaterThan(1);

            IngestResult second = service.ingest("TRV-1", "Travel is suspended until further notice.", "Travel");

            assertThat(second.chunkCount()).isEqualTo(1);
            assertThat(store.getVectorCount()).isEqualTo(1);
            assertThat(storedTexts()).containsExactly("Travel is suspended until further notice.");
            assertThat(store.getAllMetadata()).extracting(StoredDocument::chunkCount).containsExactly(1);
        }

        @Test
        @DisplayName("Should record ingestion metrics")
        void shouldRecordMetrics() {
            service.ingest("A", "First document.", null);
            service.ingest("B", "Second document.", null);

            assertThat(registry.get("rag.documents.ingested").counter().count()).isEqualTo(2.0);
            assertThat(registry.get("rag.chunks.created").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should delete a document")
        void shouldDeleteDocument() {
            service.ingest("A", "First document.", null);

            service.delete("A");

            assertThat(service.listDocuments()).isEmpty();
            assertThat(store.getVectorCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Should require an id when the front matter has none")
        void shouldRequireId() {
            assertThatThrownBy(() -> service.ingest(" ", "Some text", null))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Should reject a document with no body")
        void shouldRejectEmptyBody() {
            assertThatThrownBy(() -> service.ingest("EMPTY", "---\ntitle: Only a header\n---\n", null))
                    .isInstanceOf(ValidationException.class);
        }
    }
}
