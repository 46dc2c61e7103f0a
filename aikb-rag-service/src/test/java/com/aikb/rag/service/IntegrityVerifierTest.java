package com.aikb.rag.service;

import com.aikb.rag.model.AnswerCitation;
import com.aikb.rag.model.IntegrityReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IntegrityVerifierTest {

    private static final String CONTEXT = "SOURCE: Leave Policy\nCONTENT: Employees get 25 days of annual leave.\n"
            + "Unused days   expire in March.";

    private final IntegrityVerifier verifier = new IntegrityVerifier();

    @Test
    @DisplayName("Should score 1.0 when there are no citations")
    void shouldScoreFullWithoutCitations() {
        assertThat(verifier.verify(List.of(), CONTEXT)).isEqualTo(IntegrityReport.NO_CITATIONS);
    }

    @Test
    @DisplayName("Should verify quotes present in the context")
    void shouldVerifyPresentQuotes() {
        IntegrityReport report = verifier.verify(List.of(
                new AnswerCitation("Leave Policy", "25 days of annual leave"),
                new AnswerCitation("Leave Policy", "Unused days expire in March")), CONTEXT);

        assertThat(report.verified()).isTrue();
        assertThat(report.verifiedQuoteCount()).isEqualTo(2);
        assertThat(report.integrityScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should flag invented and too-short quotes")
    void shouldFlagInventedAndShortQuotes() {
        IntegrityReport report = verifier.verify(List.of(
                new AnswerCitation("Leave Policy", "25 days of annual leave"),
                new AnswerCitation("Leave Policy", "30 days of paid sabbatical"),
                new AnswerCitation("Leave Policy", "25"),
                new AnswerCitation("Leave Policy", null)), CONTEXT);

        assertThat(report.verified()).isFalse();
        assertThat(report.verifiedQuoteCount()).isEqualTo(1);
        assertThat(report.unverifiedQuoteCount()).isEqualTo(3);
        assertThat(report.integrityScore()).isEqualTo(0.25);
    }
}
