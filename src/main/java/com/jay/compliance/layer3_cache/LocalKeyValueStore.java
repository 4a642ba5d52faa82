package com.jay.compliance.layer3_cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-lifetime store over a ConcurrentHashMap. Expiry is lazy: an expired
 * entry is dropped when it is next read, or by {@link #purgeExpired()}.
 */
@Slf4j
public class LocalKeyValueStore implements KeyValueStore {

    private record Entry(String value, Instant expiresAt) {
        boolean expired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry e = entries.get(key);
        if (e == null) return Optional.empty();
        if (e.expired(clock.instant())) {
            entries.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, expiry(ttl)));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        AtomicBoolean written = new AtomicBoolean(false);
        entries.compute(key, (k, current) -> {
            if (current != null && !current.expired(now)) return current;
            written.set(true);
            return new Entry(value, expiry(ttl));
        });
        return written.get();
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public long increment(String key, Duration window) {
        Instant now = clock.instant();
        Entry updated = entries.compute(key, (k, current) -> {
            if (current == null || current.expired(now)) {
                return new Entry("1", expiry(window));
            }
            long next = Long.parseLong(current.value()) + 1;
            return new Entry(String.valueOf(next), current.expiresAt());
        });
        return Long.parseLong(updated.value());
    }

    /** Drops every expired entry. Returns the number removed. */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().expired(now));
        int removed = before - entries.size();
        if (removed > 0) log.debug("Local store purged {} expired entries", removed);
        return Math.max(removed, 0);
    }

    public int size() {
        return entries.size();
    }

    private Instant expiry(Duration ttl) {
        return ttl == null ? null : clock.instant().plus(ttl);
    }
}
