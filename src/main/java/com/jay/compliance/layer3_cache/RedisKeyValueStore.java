package com.jay.compliance.layer3_cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Shared store backed by Redis. Expiry is store-native (SET EX / EXPIRE).
 * Connection and command failures surface as {@link StoreUnavailableException}.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate redis;

    @Override
    public Optional<String> get(String key) {
        return call("get", () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("set", () -> {
            if (ttl == null) redis.opsForValue().set(key, value);
            else redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        // SET NX EX: atomic check-and-set
        return call("setIfAbsent", () -> Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, value, ttl)));
    }

    @Override
    public void delete(String key) {
        call("delete", () -> redis.delete(key));
    }

    @Override
    public long increment(String key, Duration window) {
        return call("increment", () -> {
            Long count = redis.opsForValue().increment(key);
            if (count == null) {
                throw new IllegalStateException("INCR returned no value for " + key);
            }
            if (count == 1L) {
                redis.expire(key, window);
            } else {
                // A client that died between INCR and EXPIRE leaves a counter without TTL
                Long ttl = redis.getExpire(key);
                if (ttl != null && ttl == -1L) redis.expire(key, window);
            }
            return count;
        });
    }

    private <T> T call(String op, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis " + op + " failed: " + e.getMessage(), e);
        }
    }
}
