package io.ration.queue;

import java.util.List;

/** Score in [0, 100] and the factors that produced it, e.g. {@code tier:premium(30)}. */
public record Priority(int value, List<String> factors) {
    public static final int MAX = 100;

    public Priority {
        value = Math.max(0, Math.min(MAX, value));
        factors = List.copyOf(factors);
    }

    public String reason() { return String.join(",", factors); }
}
