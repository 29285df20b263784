package com.rewardradar.diagnostics;

import com.rewardradar.ratelimit.RateLimiterOccupancy;
import com.rewardradar.retry.RetryEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only state of the access layer. Carries no credentials or tokens; the home id is shortened.
 */
public record DiagnosticsSnapshot(
        Instant generatedAt,
        String homeId,
        Cache cache,
        RateLimiterOccupancy rateLimiter,
        Instant lastAuthenticatedAt,
        List<RetryEvent> recentRetryEvents,
        Map<String, List<String>> trackedDevices,
        Instant devicesUpdatedAt) {

    public record Cache(long entries, long hits, long misses, long totalRequests, double hitRate) {
    }
}
