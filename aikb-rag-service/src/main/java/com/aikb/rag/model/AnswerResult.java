package com.aikb.rag.model;

import java.util.List;

/**
 * What a successful query returns to the caller. The answer text is never redacted.
 */
public record AnswerResult(
        String answer,
        List<SourceCitation> sources,
        TokenUsage usage,
        String confidence,
        String missingInformation,
        List<AnswerCitation> aiCitations,
        IntegrityReport integrity,
        boolean truncated
) {
    public AnswerResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
        aiCitations = aiCitations == null ? List.of() : List.copyOf(aiCitations);
        usage = usage == null ? TokenUsage.NONE : usage;
    }
}
