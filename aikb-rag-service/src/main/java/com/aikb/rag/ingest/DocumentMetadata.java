package com.aikb.rag.ingest;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed view of a document's front-matter header. Unknown keys are kept in {@code raw}.
 */
public record DocumentMetadata(
        String documentId,
        String title,
        String category,
        String department,
        String owner,
        String sensitivity,
        List<String> tags,
        List<String> redactFields,
        Map<String, Object> raw
) {
    public static final DocumentMetadata EMPTY =
            new DocumentMetadata(null, null, null, null, null, null, List.of(), List.of(), Map.of());

    public DocumentMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
        redactFields = redactFields == null ? List.of() : List.copyOf(redactFields);
        raw = raw == null ? Map.of() : Map.copyOf(raw);
    }

    public boolean isEmpty() {
        return raw.isEmpty();
    }

    public String sensitivityOrDefault() {
        return sensitivity == null || sensitivity.isBlank() ? "INTERNAL" : sensitivity.trim().toUpperCase(Locale.ROOT);
    }
}
