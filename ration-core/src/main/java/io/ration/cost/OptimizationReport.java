package io.ration.cost;

import java.util.List;

/** Advisory savings for a client over the trailing week, highest savings first. */
public record OptimizationReport(String clientId, double currentCost, double potentialSavings, List<Recommendation> recommendations) {
    public OptimizationReport {
        recommendations = List.copyOf(recommendations);
    }
}
