package io.ration.ratelimit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Cumulative cap over a trailing window. Entries are pruned lazily on every access.
 */
public class SlidingWindowQuota {
    private final long windowSizeMs;
    private final double limit;
    private final Clock clock;
    private final Deque<Entry> window = new ArrayDeque<>();
    private double used;

    public SlidingWindowQuota(long windowSizeMs, double limit, Clock clock) {
        if (windowSizeMs <= 0) throw new IllegalArgumentException("windowSizeMs must be > 0");
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        this.windowSizeMs = windowSizeMs;
        this.limit = limit;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public long windowSizeMs() { return windowSizeMs; }
    public double limit() { return limit; }

    public synchronized void cleanup() {
        long cutoff = clock.millis() - windowSizeMs;
        while (!window.isEmpty() && window.peekFirst().timestamp() <= cutoff) {
            used -= window.pollFirst().amount();
        }
        if (window.isEmpty()) used = 0;
    }

    public synchronized double getCurrentUsage() {
        cleanup();
        return used;
    }

    public synchronized boolean canConsume(double amount) {
        cleanup();
        return used + amount <= limit;
    }

    /** Records the amount only when the whole of it fits under the limit. */
    public synchronized boolean consume(double amount) {
        if (!canConsume(amount)) return false;
        window.addLast(new Entry(clock.millis(), amount));
        used += amount;
        return true;
    }

    /** Removes the most recent entry of exactly this amount, undoing a consume that was rolled back. */
    public synchronized boolean refund(double amount) {
        cleanup();
        Iterator<Entry> it = window.descendingIterator();
        while (it.hasNext()) {
            Entry e = it.next();
            if (Double.compare(e.amount(), amount) == 0) {
                it.remove();
                used -= amount;
                if (window.isEmpty()) used = 0;
                return true;
            }
        }
        return false;
    }

    public synchronized double getRemaining() {
        cleanup();
        return Math.max(0, limit - used);
    }

    /** Milliseconds until the oldest entry leaves the window; 0 when the window is empty. */
    public synchronized long getResetTime() {
        cleanup();
        if (window.isEmpty()) return 0;
        long resetAt = window.peekFirst().timestamp() + windowSizeMs;
        return Math.max(0, resetAt - clock.millis());
    }

    public synchronized State exportState() {
        cleanup();
        return new State(windowSizeMs, limit, new ArrayList<>(window));
    }

    public static SlidingWindowQuota fromState(State state, Clock clock) {
        SlidingWindowQuota quota = new SlidingWindowQuota(state.windowSize(), state.limit(), clock);
        synchronized (quota) {
            if (state.window() != null) {
                state.window().stream()
                        .sorted((a, b) -> Long.compare(a.timestamp(), b.timestamp()))
                        .forEach(e -> {
                            quota.window.addLast(e);
                            quota.used += e.amount();
                        });
            }
            quota.cleanup();
        }
        return quota;
    }

    public record Entry(long timestamp, double amount) {
        @JsonCreator
        public Entry(@JsonProperty("timestamp") long timestamp, @JsonProperty("amount") double amount) {
            this.timestamp = timestamp;
            this.amount = amount;
        }
    }

    /** Checkpoint form of a quota window. */
    public record State(long windowSize, double limit, List<Entry> window) {
        @JsonCreator
        public State(@JsonProperty("windowSize") long windowSize,
                     @JsonProperty("limit") double limit,
                     @JsonProperty("window") List<Entry> window) {
            this.windowSize = windowSize;
            this.limit = limit;
            this.window = window == null ? List.of() : List.copyOf(window);
        }
    }
}
