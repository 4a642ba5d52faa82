package com.jay.compliance.layer3_cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Uses the shared store while it answers and the local store while it does not.
 * A shared-store outage is logged, never propagated.
 */
@Slf4j
public class FallbackKeyValueStore implements KeyValueStore {

    private final KeyValueStore primary;
    private final KeyValueStore fallback;
    private final AtomicBoolean degraded = new AtomicBoolean(false);

    public FallbackKeyValueStore(KeyValueStore primary, KeyValueStore fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public Optional<String> get(String key) {
        return route(s -> s.get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        route(s -> {
            s.set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return route(s -> s.setIfAbsent(key, value, ttl));
    }

    @Override
    public void delete(String key) {
        route(s -> {
            s.delete(key);
            return null;
        });
    }

    @Override
    public long increment(String key, Duration window) {
        return route(s -> s.increment(key, window));
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    private <T> T route(Function<KeyValueStore, T> op) {
        try {
            T result = op.apply(primary);
            if (degraded.compareAndSet(true, false)) {
                log.info("Shared cache store reachable again, leaving local fallback");
            }
            return result;
        } catch (StoreUnavailableException e) {
            if (degraded.compareAndSet(false, true)) {
                log.warn("Shared cache store unavailable, falling back to local store: {}", e.getMessage());
            } else {
                log.debug("Shared cache store still unavailable: {}", e.getMessage());
            }
            return op.apply(fallback);
        }
    }
}
