package com.aikb.rag.audit;

/**
 * Append-only destination for audit entries. Callers treat writes as fire-and-forget:
 * an exception thrown here is logged by the caller and never fails the request.
 */
public interface AuditSink {
    void log(AuditEntry entry);
}
