package com.aikb.rag.error;

/**
 * Caller-visible failure categories of a RAG query. The public message never contains
 * backend error text.
 */
public enum RagFailureKind {
    EMBEDDING_FAILED("The question could not be processed. Please try again."),
    RETRIEVAL_FAILED("The knowledge base could not be searched. Please try again."),
    GENERATION_FAILED("An answer could not be generated. Please try again."),
    RAG_QUERY_FAILED("The request failed unexpectedly.");

    private final String publicMessage;

    RagFailureKind(String publicMessage) {
        this.publicMessage = publicMessage;
    }

    public String publicMessage() {
        return publicMessage;
    }
}
