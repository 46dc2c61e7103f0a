package com.aikb.rag.chunk;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Retrievable slice of a document. Immutable; a re-ingested document gets a fresh set of
 * chunks instead of edits to existing ones.
 */
public record Chunk(
        String id,
        String documentId,
        int sequenceIndex,
        String text,
        List<Double> embedding
) {
    public Chunk {
        embedding = embedding == null ? null : List.copyOf(embedding);
    }

    public static Chunk of(String documentId, int sequenceIndex, String text) {
        return new Chunk(stableId(documentId, sequenceIndex, text), documentId, sequenceIndex, text, null);
    }

    public Chunk withEmbedding(List<Double> vector) {
        return new Chunk(id, documentId, sequenceIndex, text, vector);
    }

    public boolean hasEmbedding() {
        return embedding != null && !embedding.isEmpty();
    }

    // Name-based UUID so the id is accepted as a Qdrant point id and is identical across re-runs
    static String stableId(String documentId, int sequenceIndex, String text) {
        String key = documentId + ":" + sequenceIndex + ":" + text;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
