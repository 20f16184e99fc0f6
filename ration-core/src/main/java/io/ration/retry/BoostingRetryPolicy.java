package io.ration.retry;

import io.ration.core.QueueItem;

/**
 * Retries until the request's own allowance or the service-wide ceiling is used up, whichever is lower. Each retry
 * carries a priority boost so it does not starve behind fresh work.
 */
public class BoostingRetryPolicy implements RetryPolicy {
    private final int maxRetries;
    private final int boost;

    public BoostingRetryPolicy(int maxRetries, int boost) {
        this.maxRetries = Math.max(0, maxRetries);
        this.boost = Math.max(0, boost);
    }

    @Override
    public boolean shouldRetry(QueueItem item, Exception e) {
        return item.retryCount() < Math.min(item.maxRetries(), maxRetries);
    }

    @Override
    public int priorityBoost(QueueItem item) {
        return boost;
    }
}
