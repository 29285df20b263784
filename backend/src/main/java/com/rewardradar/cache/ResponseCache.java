package com.rewardradar.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Predicate;

/**
 * In-memory response cache with a TTL per entry chosen by {@link CacheTtlPolicy}. Caffeine evicts on its own
 * schedule; reads additionally check expiry against the clock so an expired entry is never returned.
 * Entries that do not match the requested key or type are treated as misses and dropped.
 */
@Slf4j
public class ResponseCache {

    private final Cache<CacheKey, CacheEntry> cache;
    private final CacheTtlPolicy ttlPolicy;
    private final Clock clock;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public ResponseCache(CacheTtlPolicy ttlPolicy, Clock clock) {
        this.ttlPolicy = ttlPolicy;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new Expiry<CacheKey, CacheEntry>() {
                    @Override
                    public long expireAfterCreate(CacheKey key, CacheEntry entry, long currentTime) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(CacheKey key, CacheEntry entry, long currentTime, long currentDuration) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(CacheKey key, CacheEntry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        CacheEntry entry = cache.getIfPresent(key);
        Instant now = clock.instant();
        if (entry == null) {
            return miss(key, "absent");
        }
        if (entry.isExpiredAt(now)) {
            cache.asMap().remove(key, entry);
            return miss(key, "expired");
        }
        if (!Objects.equals(entry.key().homeId(), key.homeId()) || !type.isInstance(entry.value())) {
            log.warn("Discarding unusable cache entry {} (expected {})", key.digest(), type.getSimpleName());
            cache.asMap().remove(key, entry);
            return miss(key, "unusable");
        }
        hits.increment();
        log.debug("Cache HIT for {} {} (age {}s)", key.kind(), key.digest(),
                Duration.between(entry.storedAt(), now).toSeconds());
        return Optional.of(type.cast(entry.value()));
    }

    /**
     * Stores {@code value} with the TTL of {@code key.kind()} as of now.
     */
    public void put(CacheKey key, Object value) {
        if (value == null) {
            return;
        }
        Duration ttl = ttlPolicy.ttlFor(key.kind());
        cache.put(key, new CacheEntry(key, value, clock.instant(), ttl));
        log.debug("Cached {} {} for {}s", key.kind(), key.digest(), ttl.toSeconds());
    }

    /**
     * Removes every entry whose key matches; other entries are untouched.
     */
    public int invalidate(Predicate<CacheKey> predicate) {
        int[] removed = {0};
        cache.asMap().keySet().removeIf(k -> {
            boolean match = predicate.test(k);
            if (match) {
                removed[0]++;
            }
            return match;
        });
        return removed[0];
    }

    public int invalidateHome(String homeId) {
        return invalidate(k -> homeId.equals(k.homeId()));
    }

    public void clear() {
        long count = cache.estimatedSize();
        cache.invalidateAll();
        log.info("Cache cleared ({} entries removed)", count);
    }

    public CacheStats stats() {
        cache.cleanUp();
        return new CacheStats(cache.estimatedSize(), hits.sum(), misses.sum());
    }

    private <T> Optional<T> miss(CacheKey key, String reason) {
        misses.increment();
        log.debug("Cache MISS for {} {} ({})", key.kind(), key.digest(), reason);
        return Optional.empty();
    }
}
