package com.aikb.rag.store;

import java.time.Instant;

public record StoredDocument(
        String docId,
        String title,
        String category,
        String department,
        String sensitivity,
        int chunkCount,
        Instant ingestedAt
) {}
