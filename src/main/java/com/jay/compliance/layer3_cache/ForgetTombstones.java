package com.jay.compliance.layer3_cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Records processed forget requests in the shared store, keyed by the hashed
 * company identifier. Cached results pulled before the tombstone are treated as
 * evicted when next read.
 */
@Slf4j
public class ForgetTombstones {

    static final String PREFIX = "forgotten:";

    private final KeyValueStore store;
    private final Duration ttl;

    public ForgetTombstones(KeyValueStore store, Duration ttl) {
        this.store = store;
        this.ttl = ttl;
    }

    public void record(String subjectHash, Instant forgottenAt) {
        store.set(PREFIX + subjectHash, String.valueOf(forgottenAt.toEpochMilli()), ttl);
    }

    /** True when a tombstone for the hash exists and was written after {@code pulledAt} (or pulledAt is unknown). */
    public boolean covers(String subjectHash, Instant pulledAt) {
        if (subjectHash == null || subjectHash.isEmpty()) return false;
        Optional<String> stamp;
        try {
            stamp = store.get(PREFIX + subjectHash);
        } catch (StoreUnavailableException e) {
            log.warn("Tombstone lookup failed: {}", e.getMessage());
            return false;
        }
        if (stamp.isEmpty()) return false;
        if (pulledAt == null) return true;
        try {
            return Instant.ofEpochMilli(Long.parseLong(stamp.get())).isAfter(pulledAt);
        } catch (NumberFormatException e) {
            log.warn("Malformed tombstone value for a forgotten subject, treating as forgotten");
            return true;
        }
    }
}
