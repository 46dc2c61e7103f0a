package com.aikb.rag.budget;

/**
 * Character based token approximation: one token per four characters, rounded up.
 * Deterministic and monotonic in text length, which is all truncation relies on.
 */
public final class TokenEstimator {

    public static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {}

    public static int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (int) ((text.length() + (long) CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);
    }

    /** Longest character count whose estimate stays within {@code tokens}. */
    public static int maxCharsFor(int tokens) {
        if (tokens <= 0) return 0;
        return (int) Math.min(Integer.MAX_VALUE, (long) tokens * CHARS_PER_TOKEN);
    }
}
