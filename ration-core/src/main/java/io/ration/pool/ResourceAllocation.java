package io.ration.pool;

/**
 * A successful reservation. {@code quotaName} is the sliding-window family the amount was also counted against,
 * or null when the resource has none.
 */
public record ResourceAllocation(String allocationId,
                                 String requestId,
                                 String clientId,
                                 String resourceType,
                                 double amountAllocated,
                                 PoolType fromPool,
                                 long allocatedAt,
                                 double costUsd,
                                 String quotaName) {
}
