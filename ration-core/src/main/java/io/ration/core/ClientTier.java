package io.ration.core;

import java.util.Locale;

/**
 * Subscription tier of a tenant. Carries the priority weight and the concurrent execution cap for the tier.
 */
public enum ClientTier {
    BASIC(10, 5),
    STANDARD(20, 20),
    PREMIUM(30, 50),
    ENTERPRISE(40, 100);

    private final int priorityWeight;
    private final int maxConcurrent;

    ClientTier(int priorityWeight, int maxConcurrent) {
        this.priorityWeight = priorityWeight;
        this.maxConcurrent = maxConcurrent;
    }

    public int priorityWeight() { return priorityWeight; }
    public int maxConcurrent() { return maxConcurrent; }

    /** Lenient parse; unknown or missing tiers are treated as basic. */
    public static ClientTier parse(String value) {
        if (value == null || value.isBlank()) return BASIC;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return BASIC;
        }
    }

    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
