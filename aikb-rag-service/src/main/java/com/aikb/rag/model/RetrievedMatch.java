package com.aikb.rag.model;

/**
 * A stored chunk returned by similarity search. Created per query, never persisted.
 * Higher score means more relevant.
 */
public record RetrievedMatch(
        String chunkId,
        String documentId,
        String title,
        double score,
        String text
) {}
