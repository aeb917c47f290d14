package com.trade.arena.sim.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-JVM {@link FastStateStore}. Used when Redis is disabled (local runs, tests).
 */
public final class InMemoryFastStateStore implements FastStateStore {

    private static final class Slot {
        final String value;
        final Instant expiresAt; // null = no expiry

        Slot(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean expiredAt(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final String prefix;
    private final Clock clock;

    public InMemoryFastStateStore(String prefix, Clock clock) {
        this.prefix = prefix == null ? "" : prefix;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    private String k(String key) {
        return prefix + key;
    }

    private Slot slot(String value, Duration ttl) {
        boolean forever = ttl == null || ttl.isZero() || ttl.isNegative();
        return new Slot(value, forever ? null : clock.instant().plus(ttl));
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        slots.put(k(key), slot(value, ttl));
    }

    @Override
    public Optional<String> get(String key) {
        String kk = k(key);
        Slot s = slots.get(kk);
        if (s == null) return Optional.empty();
        if (s.expiredAt(clock.instant())) {
            slots.remove(kk, s);
            return Optional.empty();
        }
        return Optional.ofNullable(s.value);
    }

    @Override
    public void delete(String key) {
        slots.remove(k(key));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        String kk = k(key);
        Slot fresh = slot(value, ttl);
        Instant now = clock.instant();
        // compute() runs atomically per key
        Slot winner = slots.compute(kk, (ignored, cur) -> (cur == null || cur.expiredAt(now)) ? fresh : cur);
        return winner == fresh;
    }
}
