package io.ration.store;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local store. Expired entries are dropped when read. */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore() { this(Clock.systemUTC()); }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry e = entries.get(key);
        if (e == null) return Optional.empty();
        if (e.expiresAt > 0 && clock.millis() >= e.expiresAt) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.value);
    }

    @Override
    public void put(String key, String value) {
        entries.put(key, new Entry(value, 0));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            put(key, value);
            return;
        }
        entries.put(key, new Entry(value, clock.millis() + ttl.toMillis()));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    public int size() { return entries.size(); }

    private record Entry(String value, long expiresAt) {}
}
