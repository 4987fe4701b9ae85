package com.example.convoy.mapping;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Auctions mapping kept in a local H2 MVStore file named after the mapping.
 * Expiring keys carry their deadline in a companion map and read as absent
 * once it has passed.
 */
public class EmbeddedDedupStore implements DedupStore {

        private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddedDedupStore.class);
        private static final String FILE_SUFFIX = ".mv.db";

        private final MVStore store;
        private final MVMap<String, String> values;
        private final MVMap<String, Long> deadlines;
        private final Clock clock;

        public EmbeddedDedupStore(String name, Path directory) {
                this(name, directory, Clock.systemUTC());
        }

        public EmbeddedDedupStore(String name, Path directory, Clock clock) {
                this.store = new MVStore.Builder()
                                .fileName(directory.resolve(name + FILE_SUFFIX).toString())
                                .open();
                this.values = store.openMap(name);
                this.deadlines = store.openMap(name + ".deadlines");
                this.clock = clock;
        }

        @Override
        public boolean has(String key) {
                return !isExpired(key) && values.containsKey(key);
        }

        @Override
        public Optional<String> get(String key) {
                if (isExpired(key)) {
                        return Optional.empty();
                }
                return Optional.ofNullable(values.get(key));
        }

        @Override
        public void put(String key, String value, Duration ttl) {
                LOGGER.info("Save ID {} in cache", key);
                values.put(key, value);
                if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                        deadlines.remove(key);
                } else {
                        deadlines.put(key, clock.millis() + ttl.toMillis());
                }
                store.commit();
        }

        @Override
        public void delete(String key) {
                values.remove(key);
                deadlines.remove(key);
                store.commit();
        }

        @Override
        public void close() {
                if (!store.isClosed()) {
                        store.close();
                }
        }

        private boolean isExpired(String key) {
                Long deadline = deadlines.get(key);
                if (deadline == null || deadline > clock.millis()) {
                        return false;
                }
                delete(key);
                return true;
        }
}
