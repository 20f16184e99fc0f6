package io.ration.queue;

import java.util.Locale;

/**
 * Named queues by expected wait. Declaration order is scan order; {@link #DEFERRED} is only consulted when nothing
 * else is runnable.
 */
public enum WaitClass {
    IMMEDIATE(1_000L),
    FAST(10_000L),
    NORMAL(60_000L),
    BATCH(3_600_000L),
    DEFERRED(Long.MAX_VALUE);

    private final long upperBoundMillis;

    WaitClass(long upperBoundMillis) {
        this.upperBoundMillis = upperBoundMillis;
    }

    public long upperBoundMillis() { return upperBoundMillis; }

    public String queueName() { return name().toLowerCase(Locale.ROOT); }

    public static WaitClass forWait(long estimatedWaitMillis) {
        for (WaitClass w : values()) {
            if (estimatedWaitMillis < w.upperBoundMillis) return w;
        }
        return DEFERRED;
    }

    public static WaitClass fromQueueName(String name) { return valueOf(name.toUpperCase(Locale.ROOT)); }
}
