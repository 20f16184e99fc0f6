package io.ration.scheduler;

import io.ration.error.FailureReason;

/**
 * Durable outcome of one attempt of a request. A retry writes a new record with the next attempt number;
 * a terminal record is never changed.
 */
public record ExecutionRecord(String requestId,
                              int attempt,
                              String clientId,
                              String templateName,
                              ExecutionStatus status,
                              FailureReason failureReason,
                              String errorMessage,
                              long createdAt,
                              Long startedAt,
                              Long completedAt,
                              Long durationMillis,
                              double totalCostUsd,
                              String outputData,
                              boolean cacheHit) {

    public static ExecutionRecord pending(String requestId, int attempt, String clientId, String templateName, long now) {
        return new ExecutionRecord(requestId, attempt, clientId, templateName, ExecutionStatus.PENDING, null, null,
                now, null, null, null, 0, null, false);
    }
}
