package io.ration.executor;

import io.ration.core.QueueItem;
import io.ration.core.WorkPayload;

/** One call to a worker. {@code timeoutMillis} is the effective timeout, already resolved against the default. */
public record WorkerRequest(String requestId, String clientId, int priority, String templateName, WorkPayload payload,
                            long timeoutMillis) {
    public static WorkerRequest of(QueueItem item, long defaultTimeoutMillis) {
        return new WorkerRequest(item.requestId(), item.clientId(), item.priority(), item.templateName(), item.payload(),
                item.payload().timeoutOr(defaultTimeoutMillis));
    }
}
