package com.aikb.rag.model;

public record IntegrityReport(
        boolean verified,
        int verifiedQuoteCount,
        int unverifiedQuoteCount,
        double integrityScore
) {
    public static final IntegrityReport NO_CITATIONS = new IntegrityReport(true, 0, 0, 1.0);
}
