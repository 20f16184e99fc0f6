package io.ration.scheduler;

import io.ration.pool.AllocationResult;
import io.ration.pool.ResourceAllocation;

import java.util.List;

/**
 * All allocations held for one attempt, or the decline that stopped the reservation. A failed reservation holds
 * nothing: earlier allocations have already been rolled back.
 */
public record Reservation(boolean success, List<ResourceAllocation> allocations, AllocationResult failure) {
    public Reservation {
        allocations = List.copyOf(allocations);
    }

    static Reservation reserved(List<ResourceAllocation> allocations) {
        return new Reservation(true, allocations, null);
    }

    static Reservation declined(AllocationResult failure) {
        return new Reservation(false, List.of(), failure);
    }
}
