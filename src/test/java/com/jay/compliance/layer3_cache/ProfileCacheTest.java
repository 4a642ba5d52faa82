package com.jay.compliance.layer3_cache;

import com.jay.compliance.config.ComplianceConfig;
import com.jay.compliance.config.InfrastructureConfig;
import com.jay.compliance.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ProfileCache")
class ProfileCacheTest {

    record Sample(String name, int version) {}

    private static final String KEY = "profile:NL:acme:basic";
    private static final Duration TTL = Duration.ofMinutes(10);

    private MutableClock clock;
    private LocalKeyValueStore store;
    private ExecutorService loaderPool;
    private ProfileCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        store = new LocalKeyValueStore(clock);
        loaderPool = Executors.newFixedThreadPool(4);
        cache = newCache(store);
    }

    @AfterEach
    void tearDown() {
        loaderPool.shutdownNow();
    }

    private ProfileCache newCache(KeyValueStore backing) {
        ComplianceConfig.Cache settings = new ComplianceConfig.Cache();
        settings.setInflightWaitMs(5_000);
        settings.setInflightPollMs(10);
        return new ProfileCache(backing, InfrastructureConfig.cacheMapper(), loaderPool, settings);
    }

    @Nested
    @DisplayName("get / set")
    class GetSet {

        @Test
        @DisplayName("round-trips a value until its TTL elapses")
        void ttl() {
            cache.set(KEY, new Sample("acme", 1), Duration.ofSeconds(30));
            assertThat(cache.get(KEY, Sample.class)).contains(new Sample("acme", 1));

            clock.advance(Duration.ofSeconds(30));
            assertThat(cache.get(KEY, Sample.class)).isEmpty();
        }

        @Test
        @DisplayName("unreadable JSON is evicted and reported as a miss")
        void unreadableEntry() {
            store.set(KEY, "{not json", TTL);

            assertThat(cache.get(KEY, Sample.class)).isEmpty();
            assertThat(store.get(KEY)).isEmpty();
        }

        @Test
        @DisplayName("a failing store reads as a miss")
        void storeFailure() {
            KeyValueStore broken = mock(KeyValueStore.class);
            when(broken.get(anyString())).thenThrow(new StoreUnavailableException("down", null));

            assertThat(newCache(broken).get(KEY, Sample.class)).isEmpty();
        }
    }

    @Nested
    @DisplayName("getOrLoad")
    class GetOrLoad {

        @Test
        @DisplayName("loads once and serves later calls from the store")
        void cachesLoadedValue() throws Exception {
            AtomicInteger loads = new AtomicInteger();

            Sample first = cache.getOrLoad(KEY, Sample.class, TTL, () -> new Sample("acme", loads.incrementAndGet()))
                .get(5, TimeUnit.SECONDS);
            Sample second = cache.getOrLoad(KEY, Sample.class, TTL, () -> new Sample("acme", loads.incrementAndGet()))
                .get(5, TimeUnit.SECONDS);

            assertThat(first).isEqualTo(second);
            assertThat(loads).hasValue(1);
            assertThat(cache.get(KEY, Sample.class)).contains(first);
        }

        @Test
        @DisplayName("concurrent callers for one key share a single load")
        void singleFlight() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger loads = new AtomicInteger();
            List<CompletableFuture<Sample>> callers = new ArrayList<>();

            for (int i = 0; i < 8; i++) {
                callers.add(cache.getOrLoad(KEY, Sample.class, TTL, () -> {
                    loads.incrementAndGet();
                    await(release);
                    return new Sample("acme", 7);
                }));
            }
            assertThat(cache.inFlightCount()).isEqualTo(1);
            release.countDown();

            for (CompletableFuture<Sample> f : callers) {
                assertThat(f.get(5, TimeUnit.SECONDS)).isEqualTo(new Sample("acme", 7));
            }
            assertThat(loads).hasValue(1);
        }

        @Test
        @DisplayName("a failed load fails every waiter, clears markers, and the next call retries")
        void failureClearsState() throws Exception {
            CompletableFuture<Sample> failed = cache.getOrLoad(KEY, Sample.class, TTL, () -> {
                throw new IllegalStateException("boom");
            });

            assertThatThrownBy(() -> failed.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
            assertThat(cache.inFlightCount()).isZero();
            assertThat(store.get(ProfileCache.INFLIGHT_PREFIX + KEY)).isEmpty();

            Sample retried = cache.getOrLoad(KEY, Sample.class, TTL, () -> new Sample("acme", 2))
                .get(5, TimeUnit.SECONDS);
            assertThat(retried).isEqualTo(new Sample("acme", 2));
        }

        @Test
        @DisplayName("cancelling one caller does not cancel the shared load")
        void cancellationIsPerCaller() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            CompletableFuture<Sample> quitter = cache.getOrLoad(KEY, Sample.class, TTL, () -> {
                await(release);
                return new Sample("acme", 3);
            });
            CompletableFuture<Sample> patient = cache.getOrLoad(KEY, Sample.class, TTL, () -> new Sample("other", 0));

            quitter.cancel(true);
            release.countDown();

            assertThat(patient.get(5, TimeUnit.SECONDS)).isEqualTo(new Sample("acme", 3));
            assertThat(quitter).isCancelled();
            assertThat(cache.get(KEY, Sample.class)).contains(new Sample("acme", 3));
        }

        @Test
        @DisplayName("a second node waits for the node holding the in-flight marker")
        void crossNodeWait() throws Exception {
            ProfileCache otherNode = newCache(store);
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger otherLoads = new AtomicInteger();

            CompletableFuture<Sample> leader = cache.getOrLoad(KEY, Sample.class, TTL, () -> {
                await(release);
                return new Sample("acme", 9);
            });
            waitForMarker();

            CompletableFuture<Sample> follower = otherNode.getOrLoad(KEY, Sample.class, TTL, () -> {
                otherLoads.incrementAndGet();
                return new Sample("acme", -1);
            });
            release.countDown();

            assertThat(leader.get(5, TimeUnit.SECONDS)).isEqualTo(new Sample("acme", 9));
            assertThat(follower.get(5, TimeUnit.SECONDS)).isEqualTo(new Sample("acme", 9));
            assertThat(otherLoads).hasValue(0);
        }

        @Test
        @DisplayName("a load the pool rejects fails the caller and leaves nothing in flight")
        void rejectedLoad() throws Exception {
            ExecutorService stopped = Executors.newSingleThreadExecutor();
            stopped.shutdown();
            ComplianceConfig.Cache settings = new ComplianceConfig.Cache();
            ProfileCache closing = new ProfileCache(store, InfrastructureConfig.cacheMapper(), stopped, settings);

            CompletableFuture<Sample> rejected = closing.getOrLoad(KEY, Sample.class, TTL, () -> new Sample("acme", 1));

            assertThatThrownBy(() -> rejected.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(RejectedExecutionException.class);
            assertThat(closing.inFlightCount()).isZero();

            Sample loaded = cache.getOrLoad(KEY, Sample.class, TTL, () -> new Sample("acme", 2))
                .get(5, TimeUnit.SECONDS);
            assertThat(loaded).isEqualTo(new Sample("acme", 2));
        }
    }

    private void waitForMarker() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (store.get(ProfileCache.INFLIGHT_PREFIX + KEY).isEmpty()) {
            if (System.currentTimeMillis() > deadline) throw new AssertionError("marker never written");
            Thread.sleep(5);
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("latch timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Test
    @DisplayName("log form of a key hides the query text")
    void describeHidesQuery() {
        assertThat(ProfileCache.describe("profile:NL:secret name:basic"))
            .startsWith("profile:NL:#")
            .doesNotContain("secret");
    }
}
