package io.ration.ratelimit;

import io.ration.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenBucketTest {

    @Test
    void drains_then_waits_for_refill_before_the_next_token() throws Exception {
        MutableClock clock = new MutableClock(0);
        List<Long> slept = new ArrayList<>();
        Sleeper sleeper = ms -> { slept.add(ms); clock.advanceMillis(ms); };
        TokenBucket bucket = new TokenBucket(10, 1, clock, sleeper, TokenBucket.DEFAULT_MAX_WAIT_MILLIS);

        assertTrue(bucket.consume(10));
        assertEquals(0, bucket.getAvailable());
        assertEquals(1000, bucket.getWaitTime(1));

        assertTrue(bucket.consume(1));
        assertEquals(List.of(1000L), slept, "expected a single one-second wait");
        assertEquals(0, bucket.getAvailable());
    }

    @Test
    void refill_never_exceeds_capacity() {
        MutableClock clock = new MutableClock(0);
        TokenBucket bucket = new TokenBucket(10, 1, clock);
        assertTrue(bucket.tryConsume(4));
        clock.advanceSeconds(3600);
        assertEquals(10, bucket.getAvailable());
        assertTrue(bucket.canConsume(10));
        assertFalse(bucket.canConsume(10.5));
    }

    @Test
    void refuses_without_blocking_when_wait_exceeds_ceiling() throws Exception {
        MutableClock clock = new MutableClock(0);
        List<Long> slept = new ArrayList<>();
        TokenBucket bucket = new TokenBucket(100, 0.1, clock, slept::add, TokenBucket.DEFAULT_MAX_WAIT_MILLIS);
        assertTrue(bucket.consume(100));
        // 50 tokens at 0.1/s is 500s, past the 300s ceiling
        assertFalse(bucket.consume(50));
        assertTrue(slept.isEmpty(), "expected no wait but slept " + slept);
        assertEquals(0, bucket.getAvailable());
    }

    @Test
    void can_consume_does_not_take_tokens() {
        TokenBucket bucket = new TokenBucket(5, 1, new MutableClock(0));
        assertTrue(bucket.canConsume(5));
        assertTrue(bucket.canConsume(5));
        assertEquals(5, bucket.getAvailable());
    }

    @Test
    void try_consume_is_all_or_nothing() {
        TokenBucket bucket = new TokenBucket(5, 1, new MutableClock(0));
        assertFalse(bucket.tryConsume(6));
        assertEquals(5, bucket.getAvailable());
    }

    @Test
    void refund_returns_tokens_up_to_capacity() {
        TokenBucket bucket = new TokenBucket(10, 1, new MutableClock(0));
        assertTrue(bucket.tryConsume(7));
        bucket.refund(7);
        assertEquals(10, bucket.getAvailable());
        bucket.refund(5);
        assertEquals(10, bucket.getAvailable());
    }

    @Test
    void restored_bucket_catches_up_on_refill_missed_while_down() {
        MutableClock clock = new MutableClock(1_000_000);
        TokenBucket bucket = new TokenBucket(100, 2, clock);
        assertTrue(bucket.tryConsume(100));
        TokenBucket.State saved = bucket.exportState();

        clock.advanceSeconds(20);
        TokenBucket restored = TokenBucket.fromState(saved, clock, Sleeper.system(), TokenBucket.DEFAULT_MAX_WAIT_MILLIS);
        assertEquals(40, restored.getAvailable());
        assertEquals(100, restored.capacity());
    }

    @Test
    void concurrent_consumers_never_overdraw() throws Exception {
        TokenBucket bucket = new TokenBucket(1000, 0.001, new MutableClock(0));
        int threads = 8;
        int[] granted = new int[threads];
        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int idx = t;
            Thread w = new Thread(() -> {
                for (int i = 0; i < 500; i++) if (bucket.tryConsume(1)) granted[idx]++;
            });
            workers.add(w);
            w.start();
        }
        for (Thread w : workers) w.join();
        int total = 0;
        for (int g : granted) total += g;
        assertEquals(1000, total);
        assertEquals(0, bucket.getAvailable());
    }
}
