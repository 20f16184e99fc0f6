package io.ration.cost;

import io.ration.core.ClientTier;

/** Pre-flight cost of a template run for a tier, including the safety margin. */
public record CostEstimate(String templateName,
                           ClientTier clientTier,
                           double estimated,
                           double confidence,
                           TemplateRequirements breakdown) {
}
