package io.ration.cost;

/**
 * One persisted component of a request's cost. {@code provider} groups lines for reports: an API provider
 * ({@code openai}), {@code communications}, {@code storage} or {@code compute}.
 */
public record CostLine(String provider, String resourceType, double amountUsed, double costUsd) {
}
