package com.aikb.rag.service;

/**
 * Lifecycle of one query: {@code RECEIVED → EMBEDDING → RETRIEVING → ASSEMBLING →
 * GENERATING → COMPLETED | FAILED}.
 */
public enum QueryState {
    RECEIVED,
    EMBEDDING,
    RETRIEVING,
    ASSEMBLING,
    GENERATING,
    COMPLETED,
    FAILED
}
