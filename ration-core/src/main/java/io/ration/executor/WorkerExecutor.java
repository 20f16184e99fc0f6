package io.ration.executor;

import java.util.concurrent.CompletableFuture;

/**
 * Downstream worker invocation. The returned future fails with an
 * {@link io.ration.error.ExecutorFailureException} on any error, non-success answer or timeout.
 */
public interface WorkerExecutor {
    CompletableFuture<WorkerResponse> execute(WorkerRequest request);
}
