package com.example.convoy.mapping;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Auctions mapping kept in a Redis database.
 */
public class RedisDedupStore implements DedupStore {

        private static final Logger LOGGER = LoggerFactory.getLogger(RedisDedupStore.class);

        private final StringRedisTemplate redis;

        public RedisDedupStore(StringRedisTemplate redis) {
                if (redis == null) {
                        throw new IllegalArgumentException("redis must not be null");
                }
                this.redis = redis;
        }

        @Override
        public boolean has(String key) {
                return Boolean.TRUE.equals(redis.hasKey(key));
        }

        @Override
        public Optional<String> get(String key) {
                return Optional.ofNullable(redis.opsForValue().get(key));
        }

        @Override
        public void put(String key, String value, Duration ttl) {
                LOGGER.info("Save ID {} in cache", key);
                if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                        redis.opsForValue().set(key, value);
                } else {
                        redis.opsForValue().set(key, value, ttl.toMillis(), TimeUnit.MILLISECONDS);
                }
        }

        @Override
        public void delete(String key) {
                redis.delete(key);
        }

        @Override
        public void close() {
                RedisConnectionFactory connectionFactory = redis.getConnectionFactory();
                if (connectionFactory instanceof DisposableBean) {
                        try {
                                ((DisposableBean) connectionFactory).destroy();
                        } catch (Exception e) {
                                LOGGER.warn("Error closing redis connection factory: {}", e.getMessage());
                        }
                }
        }
}
