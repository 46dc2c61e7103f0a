package com.aikb.rag.error;

public class StageTimeoutException extends RuntimeException {

    private final String stage;
    private final long allottedMs;

    public StageTimeoutException(String stage, long allottedMs, String message) {
        super(stage + ": " + message);
        this.stage = stage;
        this.allottedMs = allottedMs;
    }

    public String getStage() {
        return stage;
    }

    public long getAllottedMs() {
        return allottedMs;
    }
}
