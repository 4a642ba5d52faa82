package com.jay.compliance.layer3_cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared mutable state of the service: cached results, single-flight markers,
 * rate-limit counters and forget tombstones. Every mutation is a single atomic
 * store operation; callers never take locks around it.
 *
 * Implementations backed by a remote store throw {@link StoreUnavailableException}
 * when the store cannot be reached.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /** Writes only when no live value exists. Returns true if this call wrote it. */
    boolean setIfAbsent(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * Atomically increments a counter and returns the post-increment value.
     * The first increment of a key arms its expiry to {@code window}; later
     * increments leave the expiry untouched.
     */
    long increment(String key, Duration window);
}
