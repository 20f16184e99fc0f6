package io.ration.cost;

import java.util.List;

public record CostBreakdown(String requestId, String clientId, double total, List<CostLine> lines, long timestamp) {
    public static final String CURRENCY = "USD";

    public CostBreakdown {
        lines = List.copyOf(lines);
    }
}
