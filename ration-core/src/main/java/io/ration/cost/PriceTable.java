package io.ration.cost;

import io.ration.core.ClientTier;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static USD prices by provider and model, message channel, storage class and compute unit, plus the model each
 * client tier is served by default.
 */
public final class PriceTable {
    private final Map<String, Map<String, ModelPrice>> models;
    private final Map<String, Map<ClientTier, String>> modelsByTier;
    private final double emailRate;
    private final double smsRate;
    private final Map<String, StoragePrice> storage;
    private final double perInvocation;
    private final double perCpuMillisecond;

    public PriceTable(Map<String, Map<String, ModelPrice>> models,
                      Map<String, Map<ClientTier, String>> modelsByTier,
                      double emailRate,
                      double smsRate,
                      Map<String, StoragePrice> storage,
                      double perInvocation,
                      double perCpuMillisecond) {
        this.models = Map.copyOf(models);
        this.modelsByTier = Map.copyOf(modelsByTier);
        this.emailRate = emailRate;
        this.smsRate = smsRate;
        this.storage = Map.copyOf(storage);
        this.perInvocation = perInvocation;
        this.perCpuMillisecond = perCpuMillisecond;
    }

    public static PriceTable defaults() {
        Map<String, ModelPrice> openai = new LinkedHashMap<>();
        openai.put("gpt-4", new ModelPrice(0.03, 0.06));
        openai.put("gpt-4-turbo", new ModelPrice(0.01, 0.03));
        openai.put("gpt-3.5-turbo", new ModelPrice(0.0015, 0.002));
        openai.put("gpt-4o-mini", new ModelPrice(0.00015, 0.0006));
        Map<String, ModelPrice> anthropic = new LinkedHashMap<>();
        anthropic.put("claude-3-opus", new ModelPrice(0.015, 0.075));
        anthropic.put("claude-3-sonnet", new ModelPrice(0.003, 0.015));
        anthropic.put("claude-3-haiku", new ModelPrice(0.00025, 0.00125));

        Map<ClientTier, String> openaiTiers = new EnumMap<>(ClientTier.class);
        openaiTiers.put(ClientTier.ENTERPRISE, "gpt-4");
        openaiTiers.put(ClientTier.PREMIUM, "gpt-4-turbo");
        openaiTiers.put(ClientTier.STANDARD, "gpt-3.5-turbo");
        openaiTiers.put(ClientTier.BASIC, "gpt-3.5-turbo");
        Map<ClientTier, String> anthropicTiers = new EnumMap<>(ClientTier.class);
        anthropicTiers.put(ClientTier.ENTERPRISE, "claude-3-opus");
        anthropicTiers.put(ClientTier.PREMIUM, "claude-3-sonnet");
        anthropicTiers.put(ClientTier.STANDARD, "claude-3-haiku");
        anthropicTiers.put(ClientTier.BASIC, "claude-3-haiku");

        Map<String, StoragePrice> storage = new LinkedHashMap<>();
        storage.put("kv", new StoragePrice(0.0000005, 0.000005, 0.50));
        storage.put("r2", new StoragePrice(0.0000004, 0.0000045, 0.015));
        storage.put("d1", new StoragePrice(0.0000001, 0.000001, 0.75));

        return new PriceTable(Map.of("openai", openai, "anthropic", anthropic),
                Map.of("openai", openaiTiers, "anthropic", anthropicTiers),
                0.0001, 0.0075, storage, 0.0000005, 0.0000125);
    }

    public Optional<ModelPrice> model(String provider, String model) {
        Map<String, ModelPrice> byModel = models.get(provider);
        return byModel == null ? Optional.empty() : Optional.ofNullable(byModel.get(model));
    }

    /** Provider whose price list contains {@code model}. */
    public Optional<String> providerOf(String model) {
        for (Map.Entry<String, Map<String, ModelPrice>> e : models.entrySet()) {
            if (e.getValue().containsKey(model)) return Optional.of(e.getKey());
        }
        return Optional.empty();
    }

    /** Default model for a tier, falling back to the basic tier's model. */
    public Optional<String> modelForTier(String provider, ClientTier tier) {
        Map<ClientTier, String> byTier = modelsByTier.get(provider);
        if (byTier == null) return Optional.empty();
        String model = byTier.get(tier);
        return Optional.ofNullable(model != null ? model : byTier.get(ClientTier.BASIC));
    }

    public Optional<StoragePrice> storage(String type) { return Optional.ofNullable(storage.get(type)); }

    public double emailRate() { return emailRate; }
    public double smsRate() { return smsRate; }
    public double perInvocation() { return perInvocation; }
    public double perCpuMillisecond() { return perCpuMillisecond; }
}
