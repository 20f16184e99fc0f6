package io.ration.ratelimit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.util.Objects;

/**
 * Token bucket with continuous refill. Tokens are fractional; {@link #getAvailable()} reports the floor.
 * All state transitions go through the bucket monitor; waiting for refill happens outside it.
 */
public class TokenBucket {
    /** Longest refill wait a consumer may block for before the bucket refuses outright. */
    public static final long DEFAULT_MAX_WAIT_MILLIS = 300_000L;

    private final double capacity;
    private final double refillRate;
    private final Clock clock;
    private final Sleeper sleeper;
    private final long maxWaitMillis;

    private double tokens;
    private long lastRefill;

    public TokenBucket(double capacity, double refillPerSecond, Clock clock) {
        this(capacity, refillPerSecond, clock, Sleeper.system(), DEFAULT_MAX_WAIT_MILLIS);
    }

    public TokenBucket(double capacity, double refillPerSecond, Clock clock, Sleeper sleeper, long maxWaitMillis) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        if (refillPerSecond <= 0) throw new IllegalArgumentException("refillPerSecond must be > 0");
        this.capacity = capacity;
        this.refillRate = refillPerSecond;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.system() : sleeper;
        this.maxWaitMillis = Math.max(0, maxWaitMillis);
        this.tokens = capacity;
        this.lastRefill = this.clock.millis();
    }

    public double capacity() { return capacity; }
    public double refillRate() { return refillRate; }

    public synchronized boolean canConsume(double amount) {
        refill();
        return tokens >= amount;
    }

    /** Takes the tokens only if they are there right now. */
    public synchronized boolean tryConsume(double amount) {
        refill();
        if (tokens >= amount) {
            tokens -= amount;
            return true;
        }
        return false;
    }

    /**
     * Takes the tokens, blocking once for the refill wait when it is within the ceiling.
     * Returns false without blocking when the wait would exceed the ceiling.
     */
    public boolean consume(double amount) throws InterruptedException {
        return consume(amount, true);
    }

    private boolean consume(double amount, boolean mayWait) throws InterruptedException {
        long wait;
        synchronized (this) {
            refill();
            if (tokens >= amount) {
                tokens -= amount;
                return true;
            }
            wait = waitMillisFor(amount);
        }
        if (!mayWait || wait > maxWaitMillis) return false;
        sleeper.sleep(wait);
        return consume(amount, false);
    }

    /** Milliseconds until {@code amount} tokens would be available; 0 when they already are. */
    public synchronized long getWaitTime(double amount) {
        refill();
        return waitMillisFor(amount);
    }

    public synchronized long getAvailable() {
        refill();
        return (long) Math.floor(tokens);
    }

    /** Returns tokens that were taken but never used. Never overfills. */
    public synchronized void refund(double amount) {
        if (amount <= 0) return;
        refill();
        tokens = Math.min(capacity, tokens + amount);
    }

    public synchronized State exportState() {
        refill();
        return new State(capacity, tokens, refillRate, lastRefill);
    }

    /** Rebuilds a bucket from a checkpoint, crediting the refill accrued since it was taken. */
    public static TokenBucket fromState(State state, Clock clock, Sleeper sleeper, long maxWaitMillis) {
        Objects.requireNonNull(state, "state");
        TokenBucket bucket = new TokenBucket(state.capacity(), state.refillRate(), clock, sleeper, maxWaitMillis);
        synchronized (bucket) {
            bucket.tokens = Math.max(0, Math.min(state.capacity(), state.tokens()));
            bucket.lastRefill = Math.min(state.lastRefill(), bucket.clock.millis());
            bucket.refill();
        }
        return bucket;
    }

    private long waitMillisFor(double amount) {
        if (tokens >= amount) return 0;
        double deficit = amount - tokens;
        return (long) Math.ceil(deficit / refillRate * 1000.0);
    }

    private void refill() {
        long now = clock.millis();
        long elapsed = now - lastRefill;
        if (elapsed <= 0) return;
        tokens = Math.min(capacity, tokens + (elapsed / 1000.0) * refillRate);
        lastRefill = now;
    }

    /** Checkpoint form of a bucket. */
    public record State(double capacity, double tokens, double refillRate, long lastRefill) {
        @JsonCreator
        public State(@JsonProperty("capacity") double capacity,
                     @JsonProperty("tokens") double tokens,
                     @JsonProperty("refillRate") double refillRate,
                     @JsonProperty("lastRefill") long lastRefill) {
            this.capacity = capacity;
            this.tokens = tokens;
            this.refillRate = refillRate;
            this.lastRefill = lastRefill;
        }
    }
}
