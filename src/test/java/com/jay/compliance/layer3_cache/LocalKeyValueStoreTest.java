package com.jay.compliance.layer3_cache;

import com.jay.compliance.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LocalKeyValueStore")
class LocalKeyValueStoreTest {

    private MutableClock clock;
    private LocalKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        store = new LocalKeyValueStore(clock);
    }

    @Test
    @DisplayName("entries expire once their TTL has elapsed")
    void expiresLazily() {
        store.set("k", "v", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(9));
        assertThat(store.get("k")).contains("v");

        clock.advance(Duration.ofSeconds(1));
        assertThat(store.get("k")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("setIfAbsent only writes when no live entry exists")
    void setIfAbsent() {
        assertThat(store.setIfAbsent("m", "a", Duration.ofSeconds(5))).isTrue();
        assertThat(store.setIfAbsent("m", "b", Duration.ofSeconds(5))).isFalse();
        assertThat(store.get("m")).contains("a");

        clock.advance(Duration.ofSeconds(5));
        assertThat(store.setIfAbsent("m", "c", Duration.ofSeconds(5))).isTrue();
        assertThat(store.get("m")).contains("c");
    }

    @Test
    @DisplayName("increment keeps the window armed by the first increment")
    void incrementWindow() {
        Duration window = Duration.ofSeconds(60);
        assertThat(store.increment("c", window)).isEqualTo(1);
        clock.advance(Duration.ofSeconds(30));
        assertThat(store.increment("c", window)).isEqualTo(2);
        clock.advance(Duration.ofSeconds(30));
        assertThat(store.increment("c", window)).isEqualTo(1);
    }

    @Test
    @DisplayName("purgeExpired removes only expired entries")
    void purge() {
        store.set("short", "1", Duration.ofSeconds(1));
        store.set("long", "2", Duration.ofHours(1));
        store.set("forever", "3", null);
        clock.advance(Duration.ofSeconds(2));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("delete removes the key")
    void delete() {
        store.set("k", "v", Duration.ofSeconds(10));
        store.delete("k");
        assertThat(store.get("k")).isEmpty();
    }
}
