package io.ration.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Ordered, immutable map of resource type to amount. Iteration order is declaration order,
 * which is also the order resources are reserved in.
 */
public final class ResourceRequirements {
    private static final ResourceRequirements NONE = new ResourceRequirements(Map.of());

    private final Map<String, Double> amounts;

    private ResourceRequirements(Map<String, Double> amounts) {
        this.amounts = Collections.unmodifiableMap(new LinkedHashMap<>(amounts));
    }

    public static ResourceRequirements none() { return NONE; }

    @JsonCreator
    public static ResourceRequirements of(Map<String, ? extends Number> amounts) {
        if (amounts == null || amounts.isEmpty()) return NONE;
        LinkedHashMap<String, Double> copy = new LinkedHashMap<>();
        amounts.forEach((type, amount) -> {
            if (type == null || type.isBlank()) throw new IllegalArgumentException("resource type must not be blank");
            if (amount == null || !(amount.doubleValue() > 0) || Double.isInfinite(amount.doubleValue())) {
                throw new IllegalArgumentException("amount for " + type + " must be a positive number");
            }
            copy.put(type, amount.doubleValue());
        });
        return new ResourceRequirements(copy);
    }

    public static Builder builder() { return new Builder(); }

    @JsonValue
    public Map<String, Double> asMap() { return amounts; }

    public Set<String> types() { return amounts.keySet(); }
    public double amount(String type) { return amounts.getOrDefault(type, 0.0); }
    public boolean isEmpty() { return amounts.isEmpty(); }

    /** Rejects any type the registry does not know. */
    public ResourceRequirements validate(Predicate<String> knownType) {
        for (String type : amounts.keySet()) {
            if (!knownType.test(type)) throw new IllegalArgumentException("Unknown resource type: " + type);
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceRequirements that)) return false;
        return amounts.equals(that.amounts);
    }

    @Override
    public int hashCode() { return Objects.hash(amounts); }

    @Override
    public String toString() { return amounts.toString(); }

    public static final class Builder {
        private final LinkedHashMap<String, Double> amounts = new LinkedHashMap<>();

        public Builder put(String type, double amount) { amounts.put(type, amount); return this; }

        public ResourceRequirements build() { return of(amounts); }
    }
}
