package com.aikb.rag.audit;

import com.aikb.rag.entity.AuditLogEntity;
import com.aikb.rag.json.Json;
import com.aikb.rag.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Persists audit entries to the {@code audit_logs} table. Metadata is stored as a JSON
 * string.
 */
@Slf4j
public class JpaAuditSink implements AuditSink {

    private final AuditLogRepository repository;

    public JpaAuditSink(AuditLogRepository repository) {
        this.repository = repository;
    }

    @Override
    public void log(AuditEntry entry) {
        AuditLogEntity entity = AuditLogEntity.builder()
                .userId(entry.userId())
                .redactedQuery(entry.redactedQuery())
                .outcome(entry.outcome())
                .success(AuditEntry.SUCCESS.equals(entry.outcome()))
                .costEstimate(entry.costEstimate())
                .metadataJson(toJson(entry))
                .timestamp(LocalDateTime.ofInstant(entry.timestamp(), ZoneOffset.UTC))
                .build();

        repository.save(entity);
        log.debug("[AUDIT] Saved audit log for user {} with outcome {}", entry.userId(), entry.outcome());
    }

    private static String toJson(AuditEntry entry) {
        if (entry.metadata().isEmpty()) return null;
        try {
            return Json.MAPPER.writeValueAsString(entry.metadata());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize audit metadata", e);
        }
    }
}
