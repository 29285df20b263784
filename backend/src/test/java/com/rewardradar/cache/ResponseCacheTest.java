package com.rewardradar.cache;

import com.rewardradar.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheTest {

    private static final String HOME = "96a14971-525a-4420-aae9-e5aedaa129ff";
    private static final String OTHER_HOME = "11111111-2222-3333-4444-555555555555";

    // mid-day, mid-month so no boundary shortening applies
    private final MutableClock clock = MutableClock.at("2024-05-10T12:00:00Z");
    private final CacheTtlPolicy ttlPolicy = new CacheTtlPolicy(CacheTtlPolicy.defaultTtls(),
            Duration.ofMinutes(1), Duration.ofMinutes(5), clock);
    private final ResponseCache cache = new ResponseCache(ttlPolicy, clock);

    @ParameterizedTest
    @EnumSource(CacheKind.class)
    @DisplayName("value is returned before its TTL elapses and missed after")
    void ttlPerKind(CacheKind kind) {
        CacheKey key = CacheKey.of("q", HOME, kind, Map.of("p", 1));
        Duration ttl = ttlPolicy.ttlFor(kind);
        cache.put(key, "value");

        clock.advance(ttl.minusSeconds(1));
        assertThat(cache.get(key, String.class)).contains("value");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get(key, String.class)).isEmpty();
    }

    @Test
    @DisplayName("latest put wins")
    void latestPutWins() {
        CacheKey key = CacheKey.of("q", HOME, CacheKind.CURRENT_DAY, Map.of());
        cache.put(key, "first");
        cache.put(key, "second");
        assertThat(cache.get(key, String.class)).contains("second");
    }

    @Test
    @DisplayName("entry of the wrong type is a miss and is evicted")
    void wrongType_isMissAndEvicted() {
        CacheKey key = CacheKey.of("q", HOME, CacheKind.CURRENT_DAY, Map.of());
        cache.put(key, "text");
        assertThat(cache.get(key, Integer.class)).isEmpty();
        assertThat(cache.get(key, String.class)).isEmpty();
    }

    @Test
    @DisplayName("entry stored for another home under the same digest is a miss")
    void keyMismatch_isMiss() {
        CacheKey stored = CacheKey.of("q", HOME, CacheKind.CURRENT_DAY, Map.of());
        cache.put(stored, "value");
        CacheKey colliding = new CacheKey(stored.digest(), OTHER_HOME, CacheKind.CURRENT_DAY);
        assertThat(cache.get(colliding, String.class)).isEmpty();
    }

    @Test
    @DisplayName("invalidateHome removes only that home's entries")
    void invalidateHome_removesMatchingOnly() {
        CacheKey mine = CacheKey.of("q", HOME, CacheKind.CURRENT_DAY, Map.of());
        CacheKey other = CacheKey.of("q", OTHER_HOME, CacheKind.CURRENT_DAY, Map.of());
        cache.put(mine, "a");
        cache.put(other, "b");

        assertThat(cache.invalidateHome(HOME)).isEqualTo(1);
        assertThat(cache.get(mine, String.class)).isEmpty();
        assertThat(cache.get(other, String.class)).contains("b");
    }

    @Test
    @DisplayName("clear empties the cache; stats count hits and misses")
    void clearAndStats() {
        CacheKey key = CacheKey.of("q", HOME, CacheKind.HOME_LIST, Map.of());
        cache.put(key, "a");
        cache.get(key, String.class);
        cache.get(CacheKey.of("absent", HOME, CacheKind.HOME_LIST, Map.of()), String.class);

        CacheStats stats = cache.stats();
        assertThat(stats.entries()).isEqualTo(1);
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(50.0);

        cache.clear();
        assertThat(cache.get(key, String.class)).isEmpty();
        assertThat(cache.stats().entries()).isZero();
    }

    @Test
    @DisplayName("concurrent readers see the written value until expiry")
    void concurrentReaders() throws InterruptedException {
        CacheKey key = CacheKey.of("q", HOME, CacheKind.CURRENT_PERIOD, Map.of());
        cache.put(key, "value");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(200);
        AtomicInteger hits = new AtomicInteger();
        for (int i = 0; i < 200; i++) {
            pool.submit(() -> {
                if (cache.get(key, String.class).filter("value"::equals).isPresent()) {
                    hits.incrementAndGet();
                }
                done.countDown();
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(hits.get()).isEqualTo(200);
    }
}
