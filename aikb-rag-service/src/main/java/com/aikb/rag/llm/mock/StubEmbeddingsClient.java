package com.aikb.rag.llm.mock;

import com.aikb.rag.llm.EmbeddingsClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic offline embedder: hashed bag of lower-cased words, L2-normalised.
 * The same text always yields the same vector, and texts sharing words score higher
 * under cosine similarity. Used when no embedding endpoint is configured.
 */
public final class StubEmbeddingsClient implements EmbeddingsClient {

    private final int dimension;

    public StubEmbeddingsClient(int dimension) {
        if (dimension < 2) {
            throw new IllegalArgumentException("dimension must be >= 2, got " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public List<Double> embed(String text) {
        double[] v = new double[dimension];
        String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT);
        for (String word : normalized.split("[^\\p{L}\\p{N}]+")) {
            if (word.isEmpty()) continue;
            v[bucket(word)] += 1.0;
        }

        double norm = 0;
        for (double d : v) norm += d * d;
        if (norm == 0) {
            // fixed unit vector for text without words, so the result is never all zeros
            v[0] = 1.0;
            norm = 1.0;
        }
        norm = Math.sqrt(norm);

        List<Double> out = new ArrayList<>(dimension);
        for (double d : v) out.add(d / norm);
        return out;
    }

    private int bucket(String word) {
        int h = 0x811c9dc5;
        for (byte b : word.getBytes(StandardCharsets.UTF_8)) {
            h ^= b;
            h *= 0x01000193;
        }
        return Math.floorMod(h, dimension);
    }
}
