package io.ration.pool;

public record PoolStatus(String resourceType, BucketStatus shared, BucketStatus reserved) {

    public record BucketStatus(long available, double capacity, double percentage) {
        static BucketStatus of(long available, double capacity) {
            return new BucketStatus(available, capacity, capacity <= 0 ? 0 : (available / capacity) * 100.0);
        }
    }
}
