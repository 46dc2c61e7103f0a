package com.aikb.rag.dto;

/**
 * Error body returned to API callers. {@code message} is always generic text, never a
 * backend error message.
 */
public record ErrorResponse(String error, String message, boolean retryable) {}
