package com.jay.compliance.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jay.compliance.layer3_cache.FallbackKeyValueStore;
import com.jay.compliance.layer3_cache.ForgetTombstones;
import com.jay.compliance.layer3_cache.KeyValueStore;
import com.jay.compliance.layer3_cache.LocalKeyValueStore;
import com.jay.compliance.layer3_cache.ProfileCache;
import com.jay.compliance.layer3_cache.RedisKeyValueStore;
import com.jay.compliance.layer6_audit.PiiRedactor;
import com.jay.compliance.layer7_ratelimit.RateLimiter;
import io.lettuce.core.RedisURI;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the shared infrastructure from {@link ComplianceConfig}: key/value stores,
 * worker pools, the result cache and the rate limiter.
 *
 * cache.backing_store = redis → Redis with transparent local fallback
 * cache.backing_store = local → in-process map only (single node)
 */
@Slf4j
@Configuration
public class InfrastructureConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PiiRedactor piiRedactor(ComplianceConfig config) {
        return PiiRedactor.from(config);
    }

    // ── Stores ────────────────────────────────────────────────────────────────

    /**
     * Built from cache.redis_url. Lettuce connects on first use, so a local-only
     * deployment never opens a connection.
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory(ComplianceConfig config) {
        RedisURI uri = RedisURI.create(config.cache().getRedisUrl());
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        standalone.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) standalone.setUsername(uri.getUsername());
        if (uri.getPassword() != null) standalone.setPassword(uri.getPassword());

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
            .commandTimeout(Duration.ofSeconds(2));
        if (uri.isSsl()) client.useSsl();
        return new LettuceConnectionFactory(standalone, client.build());
    }

    @Bean
    public LocalKeyValueStore localStore(Clock clock) {
        return new LocalKeyValueStore(clock);
    }

    @Bean
    public KeyValueStore cacheStore(ComplianceConfig config,
                                    @Qualifier("localStore") LocalKeyValueStore localStore,
                                    ObjectProvider<StringRedisTemplate> redis) {
        if (usesRedis(config)) {
            log.info("Cache backing store: redis with local fallback");
            return new FallbackKeyValueStore(new RedisKeyValueStore(redis.getObject()), localStore);
        }
        log.info("Cache backing store: local");
        return localStore;
    }

    /** Rate-limit counters skip the fallback so an outage fails open instead of going per-node. */
    @Bean
    public KeyValueStore rateLimitStore(ComplianceConfig config,
                                        @Qualifier("localStore") LocalKeyValueStore localStore,
                                        ObjectProvider<StringRedisTemplate> redis) {
        return usesRedis(config) ? new RedisKeyValueStore(redis.getObject()) : localStore;
    }

    private static boolean usesRedis(ComplianceConfig config) {
        return "redis".equalsIgnoreCase(config.cache().getBackingStore());
    }

    // ── Worker pools ──────────────────────────────────────────────────────────

    /** Runs adapter calls. Each call is also bounded by its client's own call timeout. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sourcePool(ComplianceConfig config) {
        return Executors.newFixedThreadPool(config.orchestrator().getSourceThreads(),
            new CustomizableThreadFactory("source-"));
    }

    /** Runs shared cache loads, independent of any caller's thread. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService loaderPool(ComplianceConfig config) {
        return Executors.newFixedThreadPool(config.cache().getLoaderThreads(),
            new CustomizableThreadFactory("cache-loader-"));
    }

    // ── Cache, tombstones, rate limiter ───────────────────────────────────────

    @Bean
    public ProfileCache profileCache(@Qualifier("cacheStore") KeyValueStore cacheStore,
                                     @Qualifier("loaderPool") ExecutorService loaderPool,
                                     ComplianceConfig config) {
        return new ProfileCache(cacheStore, cacheMapper(), loaderPool, config.cache());
    }

    @Bean
    public ForgetTombstones forgetTombstones(@Qualifier("cacheStore") KeyValueStore cacheStore,
                                             ComplianceConfig config) {
        return new ForgetTombstones(cacheStore, Duration.ofSeconds(config.cache().getProfileTtlSeconds()));
    }

    @Bean
    public RateLimiter rateLimiter(@Qualifier("rateLimitStore") KeyValueStore rateLimitStore,
                                   PiiRedactor redactor,
                                   ComplianceConfig config) {
        return new RateLimiter(rateLimitStore, redactor, config.rateLimit());
    }

    /** Mapper for cached JSON. Kept out of the context so web serialisation keeps Boot's defaults. */
    public static ObjectMapper cacheMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}
