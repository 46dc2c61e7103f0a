package com.aikb.rag.service;

import com.aikb.rag.model.AnswerCitation;
import com.aikb.rag.model.IntegrityReport;

import java.util.List;

/**
 * Checks that every quote the model cites actually occurs in the context it was given.
 */
public class IntegrityVerifier {

    static final int MIN_QUOTE_LENGTH = 5;

    public IntegrityReport verify(List<AnswerCitation> citations, String context) {
        if (citations == null || citations.isEmpty()) return IntegrityReport.NO_CITATIONS;

        String haystack = normalize(context == null ? "" : context);
        int verified = 0;
        for (AnswerCitation citation : citations) {
            String quote = citation.quote() == null ? "" : normalize(citation.quote());
            if (quote.length() >= MIN_QUOTE_LENGTH && haystack.contains(quote)) {
                verified++;
            }
        }
        int unverified = citations.size() - verified;
        return new IntegrityReport(unverified == 0, verified, unverified, (double) verified / citations.size());
    }

    // Whitespace differences are not treated as misquotes
    private static String normalize(String s) {
        return s.replaceAll("\\s+", " ").trim();
    }
}
