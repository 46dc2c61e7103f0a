package com.aikb.rag.service;

import com.aikb.rag.budget.BudgetController;
import com.aikb.rag.model.RetrievedMatch;
import com.aikb.rag.model.SourceCitation;
import com.aikb.rag.redact.PiiRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns retrieved matches into the context block for the generator. Matches below the
 * similarity threshold are dropped; the rest are ordered by descending score and
 * rendered as {@code SOURCE/CONTENT} blocks until the token ceiling is reached.
 */
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    static final String BLOCK_SEPARATOR = "\n\n";
    static final String UNTITLED = "Untitled";

    private final BudgetController budgetController;
    private final PiiRedactor redactor;
    private final double minSimilarity;
    private final boolean redactContext;

    public ContextAssembler(BudgetController budgetController, PiiRedactor redactor,
                            double minSimilarity, boolean redactContext) {
        this.budgetController = budgetController;
        this.redactor = redactor;
        this.minSimilarity = minSimilarity;
        this.redactContext = redactContext;
    }

    public AssembledContext assemble(List<RetrievedMatch> matches, int tokenCeiling) {
        if (matches == null || matches.isEmpty()) return AssembledContext.EMPTY;

        List<RetrievedMatch> relevant = matches.stream()
                .filter(m -> m.score() >= minSimilarity)
                .sorted(Comparator.comparingDouble(RetrievedMatch::score).reversed())
                .toList();
        if (relevant.isEmpty()) {
            log.info("[RAG] No match reached the similarity threshold {} ({} retrieved)",
                    minSimilarity, matches.size());
            return AssembledContext.EMPTY;
        }

        StringBuilder full = new StringBuilder();
        List<Integer> contentStarts = new ArrayList<>(relevant.size());
        List<Integer> blockEnds = new ArrayList<>(relevant.size());
        for (RetrievedMatch match : relevant) {
            if (!full.isEmpty()) full.append(BLOCK_SEPARATOR);
            full.append(header(match));
            contentStarts.add(full.length());
            full.append(content(match));
            blockEnds.add(full.length());
        }

        String fullContext = full.toString();
        String context = budgetController.truncateToTokenBudget(fullContext, tokenCeiling);
        boolean truncated = context.length() < fullContext.length();

        // A match is cited when at least one character of its content survived truncation
        List<SourceCitation> citations = new ArrayList<>();
        for (int i = 0; i < relevant.size(); i++) {
            boolean kept = context.length() > contentStarts.get(i) || context.length() >= blockEnds.get(i);
            if (!kept) break;
            citations.add(SourceCitation.from(relevant.get(i)));
        }

        if (truncated) {
            log.info("[RAG] Context truncated to {} of {} chars ({} of {} sources kept)",
                    context.length(), fullContext.length(), citations.size(), relevant.size());
        }
        return new AssembledContext(context, citations, truncated);
    }

    private String header(RetrievedMatch match) {
        String title = match.title() == null || match.title().isBlank() ? UNTITLED : match.title();
        return "SOURCE: " + title + "\nCONTENT: ";
    }

    private String content(RetrievedMatch match) {
        return redactContext ? redactor.redactPii(match.text()) : match.text();
    }
}
