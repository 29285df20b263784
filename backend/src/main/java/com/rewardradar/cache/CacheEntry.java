package com.rewardradar.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached value with the instant it was stored and its TTL.
 */
public record CacheEntry(CacheKey key, Object value, Instant storedAt, Duration ttl) {

    public boolean isExpiredAt(Instant now) {
        return Duration.between(storedAt, now).compareTo(ttl) >= 0;
    }
}
