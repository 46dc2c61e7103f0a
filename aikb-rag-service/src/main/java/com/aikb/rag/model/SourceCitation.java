package com.aikb.rag.model;

public record SourceCitation(String id, String docId, String title, double score) {

    public static SourceCitation from(RetrievedMatch match) {
        return new SourceCitation(match.chunkId(), match.documentId(), match.title(), match.score());
    }
}
