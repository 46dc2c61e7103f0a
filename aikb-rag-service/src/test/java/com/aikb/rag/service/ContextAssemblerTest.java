package com.aikb.rag.service;

import com.aikb.rag.budget.BudgetController;
import com.aikb.rag.budget.TokenEstimator;
import com.aikb.rag.metrics.RagMetrics;
import com.aikb.rag.model.RetrievedMatch;
import com.aikb.rag.model.SourceCitation;
import com.aikb.rag.redact.PiiRedactor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextAssemblerTest {

    private final BudgetController budgetController = new BudgetController(
            Clock.systemUTC(), 60_000, 100, Runnable::run, new RagMetrics(new SimpleMeterRegistry()));
    private final PiiRedactor redactor = new PiiRedactor();

    private ContextAssembler assembler(boolean redactContext) {
        return new ContextAssembler(budgetController, redactor, 0.60, redactContext);
    }

    private static RetrievedMatch match(String id, String title, double score, String text) {
        return new RetrievedMatch(id, "doc-" + id, title, score, text);
    }

    @Nested
    @DisplayName("Filtering and ordering")
    class FilteringAndOrdering {

        @Test
        @DisplayName("Should return empty context for no matches")
        void shouldReturnEmptyForNoMatches() {
            assertThat(assembler(true).assemble(List.of(), 1_000)).isEqualTo(AssembledContext.EMPTY);
        }

        @Test
        @DisplayName("Should drop matches below the similarity threshold")
        void shouldDropLowScoringMatches() {
            AssembledContext ctx = assembler(true).assemble(List.of(
                    match("a", "Travel", 0.55, "Trains are preferred."),
                    match("b", "Expenses", 0.30, "Receipts are required.")), 1_000);

            assertThat(ctx.isEmpty()).isTrue();
            assertThat(ctx.citations()).isEmpty();
        }

        @Test
        @DisplayName("Should order blocks by descending score and cite each source")
        void shouldOrderByDescendingScore() {
            AssembledContext ctx = assembler(true).assemble(List.of(
                    match("a", "Travel", 0.70, "Trains are preferred."),
                    match("b", "Leave", 0.95, "25 days of leave."),
                    match("c", null, 0.80, "Untitled content.")), 1_000);

            assertThat(ctx.context()).isEqualTo(
                    "SOURCE: Leave\nCONTENT: 25 days of leave.\n\n"
                            + "SOURCE: Untitled\nCONTENT: Untitled content.\n\n"
                            + "SOURCE: Travel\nCONTENT: Trains are preferred.");
            assertThat(ctx.citations()).extracting(SourceCitation::id).containsExactly("b", "c", "a");
            assertThat(ctx.citations().get(0)).isEqualTo(new SourceCitation("b", "doc-b", "Leave", 0.95));
            assertThat(ctx.truncated()).isFalse();
        }
    }

    @Nested
    @DisplayName("Redaction")
    class Redaction {

        @Test
        @DisplayName("Should scrub PII from chunk text when enabled")
        void shouldScrubPiiWhenEnabled() {
            AssembledContext ctx = assembler(true).assemble(List.of(
                    match("a", "Contacts", 0.9, "Email payroll@example.com for questions.")), 1_000);

            assertThat(ctx.context()).contains("[EMAIL REDACTED]").doesNotContain("payroll@example.com");
        }

        @Test
        @DisplayName("Should keep chunk text as stored when disabled")
        void shouldKeepTextWhenDisabled() {
            AssembledContext ctx = assembler(false).assemble(List.of(
                    match("a", "Contacts", 0.9, "Email payroll@example.com for questions.")), 1_000);

            assertThat(ctx.context()).contains("payroll@example.com");
        }
    }

    @Nested
    @DisplayName("Token ceiling")
    class TokenCeiling {

        @Test
        @DisplayName("Should truncate to the ceiling and cite only sources that made it in")
        void shouldTruncateAndCiteSurvivors() {
            AssembledContext ctx = assembler(true).assemble(List.of(
                    match("a", "A", 0.9, "x".repeat(400)),
                    match("b", "B", 0.8, "y".repeat(400))), 50);

            assertThat(ctx.truncated()).isTrue();
            assertThat(TokenEstimator.estimate(ctx.context())).isLessThanOrEqualTo(50);
            assertThat(ctx.citations()).extracting(SourceCitation::id).containsExactly("a");
        }

        @Test
        @DisplayName("Should cite a source whose block was partly kept")
        void shouldCitePartiallyKeptSource() {
            // first block is 19 + 100 chars, the separator 2, so the second block starts at 121
            AssembledContext ctx = assembler(true).assemble(List.of(
                    match("a", "A", 0.9, "x".repeat(100)),
                    match("b", "B", 0.8, "y".repeat(400))), 40);

            assertThat(ctx.truncated()).isTrue();
            assertThat(ctx.citations()).extracting(SourceCitation::id).containsExactly("a", "b");
        }

        @Test
        @DisplayName("Should not cite a source when only its header was kept")
        void shouldNotCiteHeaderOnlySource() {
            // second block content starts at 121 + 19 = 140 chars, exactly the 35-token ceiling
            AssembledContext ctx = assembler(true).assemble(List.of(
                    match("a", "A", 0.9, "x".repeat(100)),
                    match("b", "B", 0.8, "y".repeat(400))), 35);

            assertThat(ctx.context()).endsWith("SOURCE: B\nCONTENT: ");
            assertThat(ctx.citations()).extracting(SourceCitation::id).containsExactly("a");
        }
    }
}
