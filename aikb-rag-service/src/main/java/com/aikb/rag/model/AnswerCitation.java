package com.aikb.rag.model;

/**
 * A citation as reported by the model: the source it names and the quote it claims to
 * have taken from it.
 */
public record AnswerCitation(String source, String quote) {}
