package io.ration.pool;

import java.util.Objects;

/**
 * Static definition of one metered resource: its shared and reserved bucket sizes and its price.
 */
public record ResourceDescriptor(String resourceType,
                                 String resourceName,
                                 String provider,
                                 double capacity,
                                 double refillRatePerSecond,
                                 double reservedCapacity,
                                 double reservedRefillRatePerSecond,
                                 UnitPrice costPerUnit) {
    public ResourceDescriptor {
        Objects.requireNonNull(resourceType, "resourceType");
        if (capacity <= 0 || refillRatePerSecond <= 0) {
            throw new IllegalArgumentException("shared bucket for " + resourceType + " must have positive capacity and refill");
        }
        if (reservedCapacity <= 0 || reservedRefillRatePerSecond <= 0) {
            throw new IllegalArgumentException("reserved bucket for " + resourceType + " must have positive capacity and refill");
        }
        costPerUnit = costPerUnit == null ? UnitPrice.free() : costPerUnit;
    }

    /** Shared bucket plus a reserved bucket of one tenth its size, the usual split. */
    public static ResourceDescriptor of(String type, String name, String provider, double capacity, double refillPerSecond, UnitPrice price) {
        return new ResourceDescriptor(type, name, provider, capacity, refillPerSecond, capacity / 10.0, refillPerSecond / 10.0, price);
    }
}
