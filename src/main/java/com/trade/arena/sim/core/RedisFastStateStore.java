package com.trade.arena.sim.core;

import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis implementation using StringRedisTemplate; TTLs are enforced by Redis itself.
 * Keys are prefixed with the provided prefix (e.g., "arena:").
 */
public final class RedisFastStateStore implements FastStateStore {

    private final StringRedisTemplate redis;
    private final String prefix;

    public RedisFastStateStore(StringRedisTemplate redis, String prefix) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.prefix = prefix == null ? "" : prefix;
    }

    private String k(String key) {
        return prefix + key;
    }

    private static boolean hasTtl(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        if (hasTtl(ttl)) {
            redis.opsForValue().set(k(key), value, ttl);
        } else {
            redis.opsForValue().set(k(key), value);
        }
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(k(key)));
    }

    @Override
    public void delete(String key) {
        redis.delete(k(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Boolean ok = hasTtl(ttl)
                ? redis.opsForValue().setIfAbsent(k(key), value, ttl)
                : redis.opsForValue().setIfAbsent(k(key), value);
        return Boolean.TRUE.equals(ok);
    }
}
