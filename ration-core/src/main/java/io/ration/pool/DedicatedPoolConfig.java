package io.ration.pool;

/** Stored bucket configuration for a client's dedicated pool of one resource. */
public record DedicatedPoolConfig(String clientId, String resourceType, double capacity, double refillRatePerSecond) {
}
