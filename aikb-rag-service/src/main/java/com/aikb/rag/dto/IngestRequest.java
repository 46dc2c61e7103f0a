package com.aikb.rag.dto;

import com.aikb.rag.error.ValidationException;

/**
 * @param docId optional when the text carries a {@code document_id} in its front matter
 */
public record IngestRequest(
        String docId,
        String title,
        String text
) {
    public void validate() {
        if (text == null || text.isBlank()) {
            throw new ValidationException("text is required");
        }
    }
}
