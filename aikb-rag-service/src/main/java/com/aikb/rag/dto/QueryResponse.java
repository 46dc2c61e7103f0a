package com.aikb.rag.dto;

import com.aikb.rag.model.AnswerCitation;
import com.aikb.rag.model.AnswerResult;
import com.aikb.rag.model.IntegrityReport;
import com.aikb.rag.model.SourceCitation;
import com.aikb.rag.model.TokenUsage;

import java.util.List;

public record QueryResponse(
        String answer,
        List<SourceCitation> sources,
        TokenUsage usage,
        String confidence,
        String missingInformation,
        List<AnswerCitation> aiCitations,
        IntegrityReport integrity,
        boolean truncated
) {
    public static QueryResponse from(AnswerResult result) {
        return new QueryResponse(
                result.answer(),
                result.sources(),
                result.usage(),
                result.confidence(),
                result.missingInformation(),
                result.aiCitations(),
                result.integrity(),
                result.truncated());
    }
}
