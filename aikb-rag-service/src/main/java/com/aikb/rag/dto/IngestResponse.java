package com.aikb.rag.dto;

import com.aikb.rag.service.IngestResult;

public record IngestResponse(
        boolean success,
        String docId,
        String title,
        int chunksCreated,
        String sensitivity,
        String message
) {
    public static IngestResponse success(IngestResult result) {
        return new IngestResponse(true, result.docId(), result.title(), result.chunkCount(),
                result.sensitivity(), "Document ingested successfully");
    }
}
