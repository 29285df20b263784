package com.rewardradar.cache;

/**
 * Hit/miss counters and current size.
 */
public record CacheStats(long entries, long hits, long misses) {

    public long totalRequests() {
        return hits + misses;
    }

    public double hitRate() {
        long total = totalRequests();
        return total == 0 ? 0.0 : hits * 100.0 / total;
    }
}
