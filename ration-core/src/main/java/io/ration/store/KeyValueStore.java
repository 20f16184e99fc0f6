package io.ration.store;

import java.time.Duration;
import java.util.Optional;

/**
 * String key-value capability used for checkpoints and short-lived caches.
 */
public interface KeyValueStore {
    Optional<String> get(String key);

    void put(String key, String value);

    /** Stores a value that disappears after {@code ttl}. */
    void put(String key, String value, Duration ttl);

    void delete(String key);
}
