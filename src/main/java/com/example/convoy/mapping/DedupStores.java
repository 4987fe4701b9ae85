package com.example.convoy.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.example.convoy.exceptions.ConfigurationException;

/**
 * Opens the auctions mapping for the configured backend and runs the
 * optional startup self-check.
 */
public final class DedupStores {

        private static final Logger LOGGER = LoggerFactory.getLogger(DedupStores.class);

        static final String CHECK_KEY = "test";
        static final String CHECK_VALUE = "1";

        private DedupStores() {
        }

        public static DedupStore open(DedupStoreSettings settings, boolean check) {
                DedupStore store = open(settings);
                if (check) {
                        try {
                                selfCheck(store);
                        } catch (ConfigurationException e) {
                                store.close();
                                throw e;
                        }
                }
                return store;
        }

        public static DedupStore open(DedupStoreSettings settings) {
                if (settings instanceof DedupStoreSettings.Networked) {
                        DedupStoreSettings.Networked networked = (DedupStoreSettings.Networked) settings;
                        RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration(
                                        networked.getHost(), networked.getPort());
                        redisConfig.setDatabase(networked.getDatabase());
                        if (networked.getPassword() != null) {
                                redisConfig.setPassword(RedisPassword.of(networked.getPassword()));
                        }
                        LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory(redisConfig);
                        connectionFactory.afterPropertiesSet();
                        LOGGER.info("Set redis store \"{}\" at {}:{} as auctions mapping", networked.getDatabase(),
                                        networked.getHost(), networked.getPort());
                        return new RedisDedupStore(new StringRedisTemplate(connectionFactory));
                }
                DedupStoreSettings.Embedded embedded = (DedupStoreSettings.Embedded) settings;
                try {
                        EmbeddedDedupStore store = new EmbeddedDedupStore(embedded.getName(), embedded.getDirectory());
                        LOGGER.info("Set embedded store \"{}\" as auctions mapping", embedded.getName());
                        return store;
                } catch (RuntimeException e) {
                        throw new ConfigurationException("Cannot open embedded auctions mapping " + embedded, e);
                }
        }

        /**
         * Writes a sentinel key, reads it back and removes it. Fails fast when
         * the backend is unreachable or does not behave like a key/value store.
         */
        public static void selfCheck(DedupStore store) {
                try {
                        store.put(CHECK_KEY, CHECK_VALUE);
                        require(store.has(CHECK_KEY), "sentinel key is missing after put");
                        require(store.get(CHECK_KEY).filter(CHECK_VALUE::equals).isPresent(),
                                        "sentinel key has an unexpected value");
                        store.delete(CHECK_KEY);
                        require(!store.has(CHECK_KEY), "sentinel key is still present after delete");
                } catch (ConfigurationException e) {
                        throw e;
                } catch (RuntimeException e) {
                        throw new ConfigurationException("Auctions mapping is unreachable: " + e.getMessage(), e);
                }
        }

        private static void require(boolean condition, String problem) {
                if (!condition) {
                        throw new ConfigurationException("Auctions mapping self-check failed: " + problem);
                }
        }
}
