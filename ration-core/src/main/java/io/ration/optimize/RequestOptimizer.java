package io.ration.optimize;

import io.ration.core.QueueItem;

import java.util.List;

/** Tunes a request before it is admitted, e.g. picking a cheaper model. */
@FunctionalInterface
public interface RequestOptimizer {
    OptimizationResult optimize(QueueItem item);

    static RequestOptimizer identity() { return OptimizationResult::unchanged; }

    /** Runs each optimizer on the output of the previous one. */
    static RequestOptimizer chain(List<RequestOptimizer> optimizers) {
        List<RequestOptimizer> copy = List.copyOf(optimizers);
        return item -> {
            OptimizationResult result = OptimizationResult.unchanged(item);
            for (RequestOptimizer o : copy) result = result.then(o.optimize(result.optimized()));
            return result;
        };
    }
}
