package com.aikb.rag.service;

import com.aikb.rag.model.SourceCitation;

import java.util.List;

/**
 * @param context   text handed to the generator, within the token ceiling
 * @param citations one per match whose content reached the context
 * @param truncated whether any retrieved content was cut to fit the ceiling
 */
public record AssembledContext(String context, List<SourceCitation> citations, boolean truncated) {

    public static final AssembledContext EMPTY = new AssembledContext("", List.of(), false);

    public AssembledContext {
        context = context == null ? "" : context;
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public boolean isEmpty() {
        return context.isEmpty();
    }
}
