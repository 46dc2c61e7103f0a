package com.aikb.rag.dto;

public record HealthResponse(
        String status,
        boolean storeConnected,
        long vectorCount,
        String errorMessage
) {
    public static HealthResponse healthy(long vectorCount) {
        return new HealthResponse("healthy", true, vectorCount, null);
    }

    public static HealthResponse unhealthy(String errorMessage) {
        return new HealthResponse("unhealthy", false, 0, errorMessage);
    }
}
