package com.aikb.rag.error;

import com.aikb.rag.service.QueryState;

/**
 * Terminal failure of a RAG query. {@link #getMessage()} is safe to show to callers; the
 * cause holds the backend detail and is meant for server logs only.
 */
public class RagQueryException extends RuntimeException {

    private final RagFailureKind kind;
    private final QueryState failedState;

    public RagQueryException(RagFailureKind kind, QueryState failedState, Throwable cause) {
        super(kind.publicMessage(), cause);
        this.kind = kind;
        this.failedState = failedState;
    }

    public RagFailureKind getKind() {
        return kind;
    }

    public QueryState getFailedState() {
        return failedState;
    }

    public boolean isTimeout() {
        return getCause() instanceof StageTimeoutException;
    }
}
