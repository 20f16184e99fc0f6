package io.ration.retry;

import io.ration.core.QueueItem;
import io.ration.error.ExecutorFailureException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BoostingRetryPolicyTest {
    private static final ExecutorFailureException BOOM = new ExecutorFailureException("boom");

    @Test
    void retries_until_the_request_allowance_is_used() {
        BoostingRetryPolicy policy = new BoostingRetryPolicy(5, 10);
        QueueItem item = QueueItem.builder("r1", "acme").maxRetries(2).build();

        assertTrue(policy.shouldRetry(item, BOOM));
        item = item.retried(policy.priorityBoost(item));
        assertTrue(policy.shouldRetry(item, BOOM));
        item = item.retried(policy.priorityBoost(item));
        assertFalse(policy.shouldRetry(item, BOOM));
        assertEquals(20, item.priorityBoost());
    }

    @Test
    void service_ceiling_caps_generous_requests() {
        BoostingRetryPolicy policy = new BoostingRetryPolicy(1, 10);
        QueueItem item = QueueItem.builder("r1", "acme").maxRetries(10).build();

        assertTrue(policy.shouldRetry(item, BOOM));
        assertFalse(policy.shouldRetry(item.retried(10), BOOM));
    }

    @Test
    void zero_retries_never_retries() {
        BoostingRetryPolicy policy = new BoostingRetryPolicy(3, 10);

        assertFalse(policy.shouldRetry(QueueItem.builder("r1", "acme").maxRetries(0).build(), BOOM));
    }
}
