package io.ration.core;

import java.util.Locale;

/**
 * Caller-declared urgency. Drives the priority weight and how long a shared-bucket wait is acceptable.
 */
public enum Urgency {
    LOW(0, 3_600_000L),
    NORMAL(10, 60_000L),
    HIGH(20, 10_000L),
    URGENT(30, 1_000L);

    private final int priorityWeight;
    private final long maxWaitMillis;

    Urgency(int priorityWeight, long maxWaitMillis) {
        this.priorityWeight = priorityWeight;
        this.maxWaitMillis = maxWaitMillis;
    }

    public int priorityWeight() { return priorityWeight; }
    public long maxWaitMillis() { return maxWaitMillis; }

    public static Urgency parse(String value) {
        if (value == null || value.isBlank()) return NORMAL;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }

    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
