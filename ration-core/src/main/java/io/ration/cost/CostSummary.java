package io.ration.cost;

/** Aggregated cost records for one provider and resource. */
public record CostSummary(String provider, String resourceType, double totalAmount, double totalCost, long requestCount) {
}
