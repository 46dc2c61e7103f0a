package com.aikb.rag.chunk;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits document text into ordered, overlapping chunks.
 * <p>
 * Every chunk is an exact slice of the trimmed input. Chunk {@code i+1} starts
 * {@code overlapChars} characters before the end of chunk {@code i}, so dropping that
 * prefix from every chunk after the first and concatenating gives back the input.
 * Cut points prefer, in order: paragraph breaks, sentence ends, any whitespace, and
 * finally a hard cut at {@code maxChars}.
 * <p>
 * Cuts never split a surrogate pair. A hard cut backs off one character when it would,
 * or takes the whole pair when {@code maxChars} leaves no room to back off; an overlap
 * that would start on a low surrogate is one character shorter.
 */
public class OverlappingChunker {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t\\x0B\\f\\r]*\\n\\s*");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?][\"')\\]]*\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxChars;
    private final int overlapChars;

    public OverlappingChunker(int maxChars, int overlapChars) {
        validate(maxChars, overlapChars);
        this.maxChars = maxChars;
        this.overlapChars = overlapChars;
    }

    public List<String> chunk(String text) {
        return chunk(text, maxChars, overlapChars);
    }

    public List<Chunk> chunkDocument(String documentId, String text) {
        List<String> pieces = chunk(text);
        List<Chunk> out = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            out.add(Chunk.of(documentId, i, pieces.get(i)));
        }
        return out;
    }

    public static List<String> chunk(String text, int maxChunkSize, int overlapSize) {
        validate(maxChunkSize, overlapSize);
        String body = text == null ? "" : text.strip();
        if (body.isEmpty()) return List.of();
        if (body.length() <= maxChunkSize) return List.of(body);

        List<String> out = new ArrayList<>();
        int start = 0;
        while (true) {
            int limit = start + maxChunkSize;
            if (limit >= body.length()) {
                out.add(body.substring(start));
                return out;
            }
            // end must leave at least one new character past the overlap, or the loop stalls
            int minEnd = start + overlapSize + 1;
            int end = keepPairTogether(body, findCut(body, start, minEnd, limit), minEnd);
            out.add(body.substring(start, end));
            if (end >= body.length()) return out;
            start = end - overlapSize;
            if (start < end && Character.isLowSurrogate(body.charAt(start))) {
                start++;
            }
        }
    }

    private static int findCut(String body, int start, int minEnd, int limit) {
        for (Pattern p : List.of(PARAGRAPH_BREAK, SENTENCE_END, WHITESPACE)) {
            int cut = lastMatchEnd(p, body, start, minEnd, limit);
            if (cut > 0) return cut;
        }
        return limit;
    }

    private static int keepPairTogether(String body, int end, int minEnd) {
        if (!Character.isHighSurrogate(body.charAt(end - 1))
                || end >= body.length() || !Character.isLowSurrogate(body.charAt(end))) {
            return end;
        }
        return end - 1 >= minEnd ? end - 1 : end + 1;
    }

    private static int lastMatchEnd(Pattern pattern, String body, int start, int minEnd, int limit) {
        Matcher m = pattern.matcher(body).region(start, limit);
        int best = -1;
        while (m.find()) {
            if (m.end() >= minEnd) best = m.end();
        }
        return best;
    }

    private static void validate(int maxChunkSize, int overlapSize) {
        if (maxChunkSize < 1) {
            throw new IllegalArgumentException("maxChunkSize must be >= 1, got " + maxChunkSize);
        }
        if (overlapSize < 0) {
            throw new IllegalArgumentException("overlapSize must be >= 0, got " + overlapSize);
        }
        if (overlapSize >= maxChunkSize) {
            throw new IllegalArgumentException("overlapSize (" + overlapSize
                    + ") must be smaller than maxChunkSize (" + maxChunkSize + ")");
        }
    }
}
