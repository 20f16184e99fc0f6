package io.ration.optimize;

import io.ration.core.ClientTier;
import io.ration.core.QueueItem;
import io.ration.core.Urgency;
import io.ration.cost.ModelPrice;
import io.ration.cost.PriceTable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Swaps a premium model for its economy counterpart. Urgent requests keep their model, and so do enterprise
 * clients unless the request's config sets {@code allowDowngrade}.
 */
public class ModelDowngradeOptimizer implements RequestOptimizer {
    static final Map<String, String> DOWNGRADES = Map.of(
            "gpt-4", "gpt-3.5-turbo",
            "gpt-4-turbo", "gpt-3.5-turbo",
            "claude-3-opus", "claude-3-haiku",
            "claude-3-sonnet", "claude-3-haiku");

    private final PriceTable prices;

    public ModelDowngradeOptimizer(PriceTable prices) {
        this.prices = prices;
    }

    @Override
    public OptimizationResult optimize(QueueItem item) {
        if (item.urgency() == Urgency.URGENT) return OptimizationResult.unchanged(item);
        if (item.clientTier() == ClientTier.ENTERPRISE && !Boolean.TRUE.equals(item.payload().config().get("allowDowngrade"))) {
            return OptimizationResult.unchanged(item);
        }
        String model = item.payload().model();
        String target = model == null ? null : DOWNGRADES.get(model);
        if (target == null) return OptimizationResult.unchanged(item);

        double savings = item.estimatedCost() * (1 - priceRatio(model, target));
        QueueItem downgraded = item.withPayload(item.payload().withModel(target));
        return new OptimizationResult(item, downgraded, List.of("model_downgrade:" + model + "->" + target),
                Math.max(0, savings), null);
    }

    private double priceRatio(String from, String to) {
        Optional<ModelPrice> a = prices.providerOf(from).flatMap(p -> prices.model(p, from));
        Optional<ModelPrice> b = prices.providerOf(to).flatMap(p -> prices.model(p, to));
        if (a.isEmpty() || b.isEmpty()) return 1;
        double old = blended(a.get());
        return old <= 0 ? 1 : blended(b.get()) / old;
    }

    private static double blended(ModelPrice p) {
        return 0.6 * p.inputPer1k() + 0.4 * p.outputPer1k();
    }
}
