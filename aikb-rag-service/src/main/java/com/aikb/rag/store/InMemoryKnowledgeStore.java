package com.aikb.rag.store;

import com.aikb.rag.chunk.Chunk;
import com.aikb.rag.model.RetrievedMatch;
import com.aikb.rag.retrieval.SimilarityRetriever;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for development and tests. Each document's metadata and chunks
 * are held as one immutable entry, so a replace is a single map write.
 */
@Slf4j
public class InMemoryKnowledgeStore implements KnowledgeStore, SimilarityRetriever {

    private record Entry(StoredDocument document, List<Chunk> chunks) {}

    private final Map<String, Entry> documents = new ConcurrentHashMap<>();

    @Override
    public List<StoredDocument> getAllMetadata() {
        return documents.values().stream()
                .map(Entry::document)
                .sorted(Comparator.comparing(StoredDocument::docId))
                .toList();
    }

    @Override
    public void deleteDocument(String docId) {
        if (documents.remove(docId) != null) {
            log.info("[STORE] Deleted document {}", docId);
        }
    }

    @Override
    public void upsert(StoredDocument document, List<Chunk> chunks) {
        requireEmbeddings(chunks);
        documents.merge(document.docId(), new Entry(document, List.copyOf(chunks)), (existing, incoming) -> {
            Map<String, Chunk> byId = new LinkedHashMap<>();
            existing.chunks().forEach(c -> byId.put(c.id(), c));
            incoming.chunks().forEach(c -> byId.put(c.id(), c));
            return new Entry(incoming.document(), List.copyOf(byId.values()));
        });
    }

    @Override
    public void replaceDocument(StoredDocument document, List<Chunk> chunks) {
        requireEmbeddings(chunks);
        documents.put(document.docId(), new Entry(document, List.copyOf(chunks)));
    }

    @Override
    public long getVectorCount() {
        return documents.values().stream().mapToLong(e -> e.chunks().size()).sum();
    }

    @Override
    public List<RetrievedMatch> search(List<Double> vector, int topK) {
        if (vector == null || vector.isEmpty() || topK <= 0) return List.of();

        List<RetrievedMatch> scored = new ArrayList<>();
        for (Entry entry : documents.values()) {
            for (Chunk chunk : entry.chunks()) {
                scored.add(new RetrievedMatch(
                        chunk.id(),
                        chunk.documentId(),
                        entry.document().title(),
                        cosine(vector, chunk.embedding()),
                        chunk.text()));
            }
        }
        scored.sort(Comparator.comparingDouble(RetrievedMatch::score).reversed()
                .thenComparing(RetrievedMatch::chunkId));
        return scored.size() > topK ? List.copyOf(scored.subList(0, topK)) : scored;
    }

    static double cosine(List<Double> a, List<Double> b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("Vector dimension mismatch: " + a.size() + " vs " + b.size());
        }
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i), y = b.get(i);
            dot += x * y;
            na += x * x;
            nb += y * y;
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }

    private static void requireEmbeddings(List<Chunk> chunks) {
        for (Chunk c : chunks) {
            if (!c.hasEmbedding()) {
                throw new IllegalArgumentException("Chunk " + c.id() + " has no embedding");
            }
        }
    }
}
