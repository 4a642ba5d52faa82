package com.jay.compliance.layer3_cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.compliance.config.ComplianceConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Layer 3 — Result cache with single-flight loading.
 *
 * Values are stored as JSON in the {@link KeyValueStore}. Concurrent misses for
 * the same key collapse into one load:
 *   - within this process, later callers attach to the leader's in-flight future;
 *   - across processes, the leader holds an {@code inflight:<key>} marker written
 *     with set-if-absent, and other nodes poll for the value while it exists.
 *
 * A failed load clears both markers and fails every attached caller; the next
 * caller starts a fresh load. Each caller gets its own dependent future, so a
 * caller giving up never cancels a load others are waiting on.
 *
 * Store failures and unreadable entries degrade to a miss. They are logged and
 * never fail the request.
 */
@Slf4j
public class ProfileCache {

    static final String INFLIGHT_PREFIX = "inflight:";

    private final KeyValueStore store;
    private final ObjectMapper mapper;
    private final ExecutorService loaderPool;
    private final Duration markerTtl;
    private final long waitBudgetMs;
    private final long pollMs;
    private final String nodeId = UUID.randomUUID().toString();

    private final ConcurrentMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public ProfileCache(KeyValueStore store, ObjectMapper mapper, ExecutorService loaderPool,
                        ComplianceConfig.Cache settings) {
        this.store = store;
        this.mapper = mapper;
        this.loaderPool = loaderPool;
        this.markerTtl = Duration.ofSeconds(settings.getInflightMarkerTtlSeconds());
        this.waitBudgetMs = settings.getInflightWaitMs();
        this.pollMs = Math.max(1, settings.getInflightPollMs());
    }

    // ── Plain get / set ────────────────────────────────────────────────────────

    public <T> Optional<T> get(String key, Class<T> type) {
        Optional<String> json;
        try {
            json = store.get(key);
        } catch (StoreUnavailableException e) {
            log.warn("Cache read failed for {}, treating as miss: {}", describe(key), e.getMessage());
            return Optional.empty();
        }
        if (json.isEmpty()) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(json.get(), type));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable cache entry {} dropped: {}", describe(key), e.getOriginalMessage());
            evict(key);
            return Optional.empty();
        }
    }

    public void set(String key, Object value, Duration ttl) {
        try {
            store.set(key, mapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            log.error("Value for {} is not serialisable, not cached: {}", describe(key), e.getOriginalMessage());
        } catch (StoreUnavailableException e) {
            log.warn("Cache write failed for {}: {}", describe(key), e.getMessage());
        }
    }

    public void evict(String key) {
        try {
            store.delete(key);
        } catch (StoreUnavailableException e) {
            log.warn("Cache evict failed for {}: {}", describe(key), e.getMessage());
        }
    }

    // ── Single-flight ──────────────────────────────────────────────────────────

    /**
     * Returns the cached value for {@code key}, or loads it once for all concurrent
     * callers and caches it under {@code ttl}.
     */
    public <T> CompletableFuture<T> getOrLoad(String key, Class<T> type, Duration ttl, Supplier<T> loader) {
        CompletableFuture<Object> leader = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, leader);
        if (existing != null) {
            log.debug("Joining in-flight load for {}", describe(key));
            return existing.thenApply(type::cast);
        }

        try {
            loaderPool.execute(() -> {
                Object value;
                try {
                    value = loadOnce(key, type, ttl, loader);
                } catch (Throwable t) {
                    // Unregister first: a caller arriving after the failure must start a fresh load
                    inFlight.remove(key, leader);
                    leader.completeExceptionally(t);
                    return;
                }
                inFlight.remove(key, leader);
                leader.complete(value);
            });
        } catch (RejectedExecutionException e) {
            log.warn("Loader pool rejected the load for {}: {}", describe(key), e.getMessage());
            inFlight.remove(key, leader);
            leader.completeExceptionally(e);
        }
        return leader.thenApply(type::cast);
    }

    /** Number of loads currently in flight in this process. */
    public int inFlightCount() {
        return inFlight.size();
    }

    private <T> T loadOnce(String key, Class<T> type, Duration ttl, Supplier<T> loader) {
        String marker = INFLIGHT_PREFIX + key;
        boolean owner = acquireMarker(marker);
        if (!owner) {
            Optional<T> fromPeer = awaitPeer(key, marker, type);
            if (fromPeer.isPresent()) return fromPeer.get();
            log.debug("Peer load for {} produced no value, loading locally", describe(key));
        }
        try {
            // Filled between the caller's miss and this load
            Optional<T> cached = get(key, type);
            if (cached.isPresent()) return cached.get();

            T value = loader.get();
            set(key, value, ttl);
            return value;
        } finally {
            if (owner) releaseMarker(marker);
        }
    }

    private boolean acquireMarker(String marker) {
        try {
            return store.setIfAbsent(marker, nodeId, markerTtl);
        } catch (StoreUnavailableException e) {
            log.warn("Could not write in-flight marker {}: {}", describe(marker), e.getMessage());
            return true;
        }
    }

    private void releaseMarker(String marker) {
        try {
            store.delete(marker);
        } catch (StoreUnavailableException e) {
            log.warn("Could not clear in-flight marker {}, it expires in {}s: {}",
                describe(marker), markerTtl.toSeconds(), e.getMessage());
        }
    }

    private <T> Optional<T> awaitPeer(String key, String marker, Class<T> type) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitBudgetMs);
        while (System.nanoTime() < deadline) {
            Optional<T> value = get(key, type);
            if (value.isPresent()) return value;
            if (!markerPresent(marker)) return get(key, type);
            try {
                Thread.sleep(pollMs);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for peer load of " + describe(key), ie);
            }
        }
        log.warn("Peer load for {} did not finish within {} ms", describe(key), waitBudgetMs);
        return Optional.empty();
    }

    private boolean markerPresent(String marker) {
        try {
            return store.get(marker).isPresent();
        } catch (StoreUnavailableException e) {
            return false;
        }
    }

    /**
     * Log-safe form of a key. Keys embed the query text, so only the kind and
     * country segments are kept, followed by a hash of the whole key.
     */
    static String describe(String key) {
        String[] parts = key.split(":", 4);
        StringBuilder sb = new StringBuilder();
        int keep = key.startsWith(INFLIGHT_PREFIX) ? 3 : 2;
        for (int i = 0; i < Math.min(keep, parts.length - 1); i++) {
            sb.append(parts[i]).append(':');
        }
        return sb.append('#').append(Integer.toHexString(key.hashCode())).toString();
    }
}
