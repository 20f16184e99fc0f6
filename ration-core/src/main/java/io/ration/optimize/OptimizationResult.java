package io.ration.optimize;

import io.ration.core.QueueItem;

import java.util.ArrayList;
import java.util.List;

/**
 * Variant of a request chosen before execution. {@code deferUntil} is a suggestion to run later for a discount;
 * null when no deferral applies.
 */
public record OptimizationResult(QueueItem original,
                                 QueueItem optimized,
                                 List<String> applied,
                                 double estimatedSavings,
                                 Long deferUntil) {

    public OptimizationResult {
        applied = List.copyOf(applied);
    }

    public static OptimizationResult unchanged(QueueItem item) {
        return new OptimizationResult(item, item, List.of(), 0, null);
    }

    public boolean changed() { return !applied.isEmpty(); }

    /** Applies {@code next} on top of this result. */
    OptimizationResult then(OptimizationResult next) {
        if (!next.changed()) return this;
        List<String> all = new ArrayList<>(applied);
        all.addAll(next.applied());
        Long defer = next.deferUntil() != null ? next.deferUntil() : deferUntil;
        return new OptimizationResult(original, next.optimized(), all, estimatedSavings + next.estimatedSavings(), defer);
    }
}
