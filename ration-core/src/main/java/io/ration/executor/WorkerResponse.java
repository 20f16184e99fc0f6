package io.ration.executor;

import com.fasterxml.jackson.databind.JsonNode;
import io.ration.cost.UsageReport;

/**
 * Successful worker answer. {@code output} is the worker's output document and {@code usage} what it reported
 * consuming, already grouped for pricing.
 */
public record WorkerResponse(JsonNode output, UsageReport usage, long durationMillis, boolean cached, String model) {
    public WorkerResponse {
        usage = usage == null ? UsageReport.empty() : usage;
    }
}
