package com.aikb.rag.budget;

import java.time.Instant;

/**
 * Per-request budget: an absolute deadline and a ceiling on estimated context tokens.
 * Created once when a query is received and passed by value to every stage. Never
 * extended.
 */
public record RequestBudget(Instant deadline, int tokenCeiling) {

    public RequestBudget {
        if (deadline == null) {
            throw new IllegalArgumentException("deadline is required");
        }
        if (tokenCeiling < 1) {
            throw new IllegalArgumentException("tokenCeiling must be >= 1, got " + tokenCeiling);
        }
    }
}
