package com.aikb.rag.audit;

import java.time.Instant;
import java.util.Map;

/**
 * Write-once record of one query. {@code redactedQuery} has already been through the
 * PII redactor and {@code metadata} holds counts and ids only, never chunk text.
 *
 * @param outcome {@code SUCCESS} or the failure kind
 */
public record AuditEntry(
        String userId,
        String redactedQuery,
        Instant timestamp,
        String outcome,
        double costEstimate,
        Map<String, Object> metadata
) {
    public static final String SUCCESS = "SUCCESS";

    public AuditEntry {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
