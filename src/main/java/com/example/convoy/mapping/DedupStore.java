package com.example.convoy.mapping;

import java.time.Duration;
import java.util.Optional;

/**
 * Mapping of auction IDs that were already handed to downstream processing.
 * A present key means "processed"; the value is an opaque marker.
 *
 * A TTL of null, zero or a negative duration means the key never expires.
 */
public interface DedupStore extends AutoCloseable {

        boolean has(String key);

        Optional<String> get(String key);

        default void put(String key, String value) {
                put(key, value, null);
        }

        void put(String key, String value, Duration ttl);

        void delete(String key);

        @Override
        void close();
}
