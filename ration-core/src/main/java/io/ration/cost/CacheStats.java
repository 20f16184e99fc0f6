package io.ration.cost;

public record CacheStats(long totalRequests, long cacheHits) {
    public double hitRate() { return totalRequests > 0 ? (double) cacheHits / totalRequests : 0; }
}
