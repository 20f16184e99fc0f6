package io.ration.pool;

import io.ration.error.FailureReason;
import io.ration.error.InsufficientResourcesException;
import io.ration.error.QuotaExceededException;
import io.ration.error.SchedulingException;

/**
 * Outcome of {@link ResourcePool#allocate}. Declines are values, carrying what the caller needs to retry.
 */
public record AllocationResult(boolean success,
                               ResourceAllocation allocation,
                               String resourceType,
                               FailureReason reason,
                               long waitTimeMillis,
                               long available,
                               long resetTimeMillis) {

    public static AllocationResult success(ResourceAllocation allocation) {
        return new AllocationResult(true, allocation, allocation.resourceType(), null, 0, 0, 0);
    }

    public static AllocationResult quotaExceeded(String resourceType, long resetTimeMillis) {
        return new AllocationResult(false, null, resourceType, FailureReason.QUOTA_EXCEEDED, 0, 0, resetTimeMillis);
    }

    public static AllocationResult insufficient(String resourceType, long waitTimeMillis, long available) {
        return new AllocationResult(false, null, resourceType, FailureReason.INSUFFICIENT_RESOURCES, waitTimeMillis, available, 0);
    }

    /** How long the caller should hold off before trying again. */
    public long retryAfterMillis() {
        return reason == FailureReason.QUOTA_EXCEEDED ? resetTimeMillis : waitTimeMillis;
    }

    public SchedulingException toException() {
        if (success) throw new IllegalStateException("allocation succeeded");
        if (reason == FailureReason.QUOTA_EXCEEDED) return new QuotaExceededException(resourceType, resetTimeMillis);
        return new InsufficientResourcesException(resourceType, waitTimeMillis, available);
    }
}
