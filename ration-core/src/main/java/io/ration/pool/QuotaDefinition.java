package io.ration.pool;

/**
 * Sliding-window ceiling shared by every resource whose type starts with {@code resourcePrefix}.
 */
public record QuotaDefinition(String name, String resourcePrefix, long windowMillis, double limit) {
    public boolean covers(String resourceType) {
        return resourceType != null && resourceType.startsWith(resourcePrefix);
    }
}
