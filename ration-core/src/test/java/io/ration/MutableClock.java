package io.ration;

import io.ration.ratelimit.Sleeper;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/** Clock that only moves when told to. */
public final class MutableClock extends Clock {
    private final AtomicLong millis;

    public MutableClock(long startMillis) {
        this.millis = new AtomicLong(startMillis);
    }

    public static MutableClock at(String isoInstant) {
        return new MutableClock(Instant.parse(isoInstant).toEpochMilli());
    }

    public void advanceMillis(long ms) { millis.addAndGet(ms); }
    public void advanceSeconds(long s) { advanceMillis(s * 1000L); }
    public void advanceMinutes(long m) { advanceMillis(m * 60_000L); }

    /** A sleeper that advances this clock instead of blocking. */
    public Sleeper sleeper() { return this::advanceMillis; }

    @Override public ZoneId getZone() { return ZoneOffset.UTC; }
    @Override public Clock withZone(ZoneId zone) { return this; }
    @Override public long millis() { return millis.get(); }
    @Override public Instant instant() { return Instant.ofEpochMilli(millis.get()); }
}
