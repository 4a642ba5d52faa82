package com.jay.compliance.layer7_ratelimit;

import com.jay.compliance.config.ComplianceConfig;
import com.jay.compliance.layer3_cache.KeyValueStore;
import com.jay.compliance.layer3_cache.StoreUnavailableException;
import com.jay.compliance.layer6_audit.PiiRedactor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Layer 7 — Per-caller fixed-window token bucket.
 * One counter per caller identity and window: the first increment arms the
 * window expiry, and acquisition fails once the count exceeds the budget.
 * When the store cannot be reached the request is allowed (fail open).
 */
@Slf4j
public class RateLimiter {

    static final String PREFIX = "ratelimit:";

    private final KeyValueStore store;
    private final PiiRedactor redactor;
    private final long tokens;
    private final Duration window;

    public RateLimiter(KeyValueStore store, PiiRedactor redactor, ComplianceConfig.RateLimit settings) {
        this.store = store;
        this.redactor = redactor;
        this.tokens = settings.getTokens();
        this.window = Duration.ofSeconds(settings.getWindowSeconds());
    }

    public boolean tryAcquire(String identity) {
        // Identities are API keys or client addresses; only their hash reaches the store
        String key = PREFIX + redactor.hashIdentifier(identity == null ? "anonymous" : identity);
        long count;
        try {
            count = store.increment(key, window);
        } catch (StoreUnavailableException e) {
            log.warn("Rate-limit store unavailable, allowing request: {}", e.getMessage());
            return true;
        }
        if (count > tokens) {
            log.info("Rate limit exceeded ({} > {} per {}s)", count, tokens, window.toSeconds());
            return false;
        }
        return true;
    }

    public long getTokens() {
        return tokens;
    }

    public Duration getWindow() {
        return window;
    }
}
