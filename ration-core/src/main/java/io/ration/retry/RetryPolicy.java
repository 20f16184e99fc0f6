package io.ration.retry;

import io.ration.core.QueueItem;

public interface RetryPolicy {
    boolean shouldRetry(QueueItem item, Exception e);
    int priorityBoost(QueueItem item);
}
