package io.ration.cost;

import java.time.Instant;
import java.util.List;

public record CostReport(String clientId, ReportPeriod period, Instant start, Instant end, double totalCost, List<CostSummary> breakdown) {
    public CostReport {
        breakdown = List.copyOf(breakdown);
    }

    public long requestCount() {
        long n = 0;
        for (CostSummary s : breakdown) n += s.requestCount();
        return n;
    }
}
