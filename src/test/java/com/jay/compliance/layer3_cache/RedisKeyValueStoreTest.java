package com.jay.compliance.layer3_cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisKeyValueStore")
class RedisKeyValueStoreTest {

    private static final Duration WINDOW = Duration.ofSeconds(60);

    @Mock
    private StringRedisTemplate redis;

    @Mock
    private ValueOperations<String, String> ops;

    private RedisKeyValueStore store;

    @BeforeEach
    void setUp() {
        when(redis.opsForValue()).thenReturn(ops);
        store = new RedisKeyValueStore(redis);
    }

    @Test
    @DisplayName("first increment arms the window")
    void firstIncrementSetsExpiry() {
        when(ops.increment("c")).thenReturn(1L);

        assertThat(store.increment("c", WINDOW)).isEqualTo(1);
        verify(redis).expire("c", WINDOW);
    }

    @Test
    @DisplayName("later increments keep the existing window")
    void laterIncrementKeepsExpiry() {
        when(ops.increment("c")).thenReturn(2L);
        when(redis.getExpire("c")).thenReturn(42L);

        assertThat(store.increment("c", WINDOW)).isEqualTo(2);
        verify(redis, never()).expire("c", WINDOW);
    }

    @Test
    @DisplayName("a counter left without TTL is re-armed")
    void orphanCounterRearmed() {
        when(ops.increment("c")).thenReturn(5L);
        when(redis.getExpire("c")).thenReturn(-1L);

        store.increment("c", WINDOW);
        verify(redis).expire("c", WINDOW);
    }

    @Test
    @DisplayName("connection failures surface as StoreUnavailableException")
    void connectionFailure() {
        when(ops.get("k")).thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> store.get("k")).isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @DisplayName("setIfAbsent reports whether the key was written")
    void setIfAbsent() {
        when(ops.setIfAbsent("m", "node", WINDOW)).thenReturn(true, false);

        assertThat(store.setIfAbsent("m", "node", WINDOW)).isTrue();
        assertThat(store.setIfAbsent("m", "node", WINDOW)).isFalse();
    }
}
