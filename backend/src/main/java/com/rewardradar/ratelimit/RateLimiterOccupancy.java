package com.rewardradar.ratelimit;

import java.time.Instant;

/**
 * Read-only view of both windows for diagnostics.
 */
public record RateLimiterOccupancy(int hourlyCount, int hourlyCapacity, Instant hourlyWindowStart,
                                   int burstCount, int burstCapacity, Instant burstWindowStart) {
}
