package com.rewardradar.cache;

/**
 * Data category of a cached response; selects its TTL.
 */
public enum CacheKind {
    HOME_LIST,
    DEVICE_LIST,
    CURRENT_DAY,
    CURRENT_PERIOD,
    HISTORICAL_PERIOD
}
