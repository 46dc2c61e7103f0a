package com.aikb.rag.error;

/**
 * An embedding, retrieval or generation backend answered with an error. Not retried
 * within the same request.
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
