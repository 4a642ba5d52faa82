package com.jay.compliance.layer7_ratelimit;

import com.jay.compliance.config.ComplianceConfig;
import com.jay.compliance.layer3_cache.KeyValueStore;
import com.jay.compliance.layer3_cache.LocalKeyValueStore;
import com.jay.compliance.layer3_cache.StoreUnavailableException;
import com.jay.compliance.layer6_audit.PiiRedactor;
import com.jay.compliance.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("RateLimiter")
class RateLimiterTest {

    private MutableClock clock;
    private LocalKeyValueStore store;
    private RateLimiter limiter;
    private final PiiRedactor redactor = new PiiRedactor("k");

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        store = new LocalKeyValueStore(clock);
        limiter = new RateLimiter(store, redactor, settings(3, 60));
    }

    private static ComplianceConfig.RateLimit settings(long tokens, long windowSeconds) {
        ComplianceConfig.RateLimit s = new ComplianceConfig.RateLimit();
        s.setTokens(tokens);
        s.setWindowSeconds(windowSeconds);
        return s;
    }

    @Test
    @DisplayName("rejects once the budget is spent, until the window rolls over")
    void budget() {
        assertThat(limiter.tryAcquire("caller")).isTrue();
        assertThat(limiter.tryAcquire("caller")).isTrue();
        assertThat(limiter.tryAcquire("caller")).isTrue();
        assertThat(limiter.tryAcquire("caller")).isFalse();

        clock.advance(Duration.ofSeconds(60));
        assertThat(limiter.tryAcquire("caller")).isTrue();
    }

    @Test
    @DisplayName("callers have separate budgets")
    void perCaller() {
        for (int i = 0; i < 3; i++) limiter.tryAcquire("a");

        assertThat(limiter.tryAcquire("a")).isFalse();
        assertThat(limiter.tryAcquire("b")).isTrue();
    }

    @Test
    @DisplayName("counter keys carry only the hashed identity")
    void hashedKey() {
        limiter.tryAcquire("secret-api-key");

        assertThat(store.get("ratelimit:" + redactor.hashIdentifier("secret-api-key"))).contains("1");
        assertThat(store.get("ratelimit:secret-api-key")).isEmpty();
    }

    @Test
    @DisplayName("fails open when the store is unreachable")
    void failOpen() {
        KeyValueStore broken = mock(KeyValueStore.class);
        when(broken.increment(anyString(), any())).thenThrow(new StoreUnavailableException("down", null));
        RateLimiter open = new RateLimiter(broken, redactor, settings(1, 60));

        assertThat(open.tryAcquire("caller")).isTrue();
        assertThat(open.tryAcquire("caller")).isTrue();
    }
}
