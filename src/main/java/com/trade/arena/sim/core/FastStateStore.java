package com.trade.arena.sim.core;

import java.time.Duration;
import java.util.Optional;

/**
 * A small key-value store with per-key TTL. Holds run-once markers for batch jobs and the
 * cached quote-provider access token.
 *
 * Contracts:
 *  - All methods are thread-safe.
 *  - TTL of null or non-positive means "no expiry".
 *  - Expired entries disappear lazily on access; there is no background sweep.
 */
public interface FastStateStore {

    void put(String key, String value, Duration ttl);

    Optional<String> get(String key);

    void delete(String key);

    /**
     * Atomic "set if absent" with TTL, used as a run-once claim.
     *
     * @return true when this caller created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);
}
