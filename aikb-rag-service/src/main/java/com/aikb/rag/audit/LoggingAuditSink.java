package com.aikb.rag.audit;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingAuditSink implements AuditSink {

    @Override
    public void log(AuditEntry entry) {
        log.info("[AUDIT] user={} outcome={} cost={} query=\"{}\" metadata={}",
                entry.userId(), entry.outcome(), entry.costEstimate(), entry.redactedQuery(), entry.metadata());
    }
}
