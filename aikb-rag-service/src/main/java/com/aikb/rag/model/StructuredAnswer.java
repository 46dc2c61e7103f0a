package com.aikb.rag.model;

import java.util.List;

/**
 * Generator output after schema validation.
 */
public record StructuredAnswer(
        String answer,
        String confidence,
        List<AnswerCitation> citations,
        String missingInformation
) {
    public StructuredAnswer {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public boolean hasMissingInformation() {
        return missingInformation != null
                && !missingInformation.isBlank()
                && !"none".equalsIgnoreCase(missingInformation.trim());
    }
}
