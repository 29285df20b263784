package com.rewardradar.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * TTL per {@link CacheKind}, looked up from a table. Current-period data gets a shorter TTL close to the
 * end of its period, when the API updates it.
 */
public class CacheTtlPolicy {

    private static final int DAY_END_HOURS = 2;
    private static final int MONTH_END_DAYS = 2;

    private final Map<CacheKind, Duration> ttlByKind;
    private final Duration dayEndTtl;
    private final Duration monthEndTtl;
    private final Clock clock;

    public CacheTtlPolicy(Map<CacheKind, Duration> ttlByKind, Duration dayEndTtl, Duration monthEndTtl, Clock clock) {
        this.ttlByKind = new EnumMap<>(CacheKind.class);
        this.ttlByKind.putAll(ttlByKind);
        for (CacheKind kind : CacheKind.values()) {
            if (!this.ttlByKind.containsKey(kind)) {
                throw new IllegalArgumentException("No TTL configured for " + kind);
            }
        }
        this.dayEndTtl = dayEndTtl;
        this.monthEndTtl = monthEndTtl;
        this.clock = clock;
    }

    public Duration ttlFor(CacheKind kind) {
        Duration ttl = ttlByKind.get(kind);
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        if (kind == CacheKind.CURRENT_DAY && 24 - now.getHour() <= DAY_END_HOURS) {
            return min(ttl, dayEndTtl);
        }
        if (kind == CacheKind.CURRENT_PERIOD
                && now.getDayOfMonth() >= now.toLocalDate().lengthOfMonth() - MONTH_END_DAYS) {
            return min(ttl, monthEndTtl);
        }
        return ttl;
    }

    /**
     * Default table: homes 1h, devices 30min, current day 5min, current period 15min, historical 1h.
     */
    public static Map<CacheKind, Duration> defaultTtls() {
        Map<CacheKind, Duration> ttls = new EnumMap<>(CacheKind.class);
        ttls.put(CacheKind.HOME_LIST, Duration.ofHours(1));
        ttls.put(CacheKind.DEVICE_LIST, Duration.ofMinutes(30));
        ttls.put(CacheKind.CURRENT_DAY, Duration.ofMinutes(5));
        ttls.put(CacheKind.CURRENT_PERIOD, Duration.ofMinutes(15));
        ttls.put(CacheKind.HISTORICAL_PERIOD, Duration.ofHours(1));
        return ttls;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
