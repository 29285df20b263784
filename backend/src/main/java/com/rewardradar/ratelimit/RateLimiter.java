package com.rewardradar.ratelimit;

import com.rewardradar.domain.RateLimiterState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-tier limiter: a request is admitted only when both the hourly and the burst window have room,
 * and admission counts against both. State can be snapshotted and restored so a restart does not
 * reopen an exhausted window.
 */
@Slf4j
public class RateLimiter {

    public static final Duration HOURLY_WINDOW = Duration.ofHours(1);

    private final RateWindow hourly;
    private final RateWindow burst;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean dirty;

    public RateLimiter(int hourlyCapacity, int burstCapacity, Duration burstWindow, Clock clock) {
        Instant now = clock.instant();
        this.hourly = new RateWindow("hourly", hourlyCapacity, HOURLY_WINDOW, now);
        this.burst = new RateWindow("burst", burstCapacity, burstWindow, now);
        this.clock = clock;
    }

    /**
     * Non-blocking: admits and counts the request, or reports how long until the nearest full window resets.
     * A denial leaves the counters untouched.
     */
    public RateLimitDecision tryAcquire() {
        lock.lock();
        try {
            Instant now = clock.instant();
            hourly.roll(now);
            burst.roll(now);
            if (hourly.hasCapacity() && burst.hasCapacity()) {
                hourly.increment();
                burst.increment();
                dirty = true;
                return RateLimitDecision.admitted();
            }
            Duration wait = null;
            for (RateWindow window : new RateWindow[]{hourly, burst}) {
                if (!window.hasCapacity()) {
                    Duration untilReset = window.untilReset(now);
                    if (wait == null || untilReset.compareTo(wait) < 0) {
                        wait = untilReset;
                    }
                }
            }
            log.debug("Rate limit reached (hourly {}/{}, burst {}/{}), retry after {}",
                    hourly.count(), hourly.capacity(), burst.count(), burst.capacity(), wait);
            return RateLimitDecision.denied(wait);
        } finally {
            lock.unlock();
        }
    }

    public RateLimiterState snapshot(String stateId) {
        lock.lock();
        try {
            return toState(stateId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot taken only if anything was admitted since the last one; clears the dirty flag.
     */
    public Optional<RateLimiterState> snapshotIfDirty(String stateId) {
        lock.lock();
        try {
            if (!dirty) {
                return Optional.empty();
            }
            dirty = false;
            return Optional.of(toState(stateId));
        } finally {
            lock.unlock();
        }
    }

    public void markDirty() {
        lock.lock();
        try {
            dirty = true;
        } finally {
            lock.unlock();
        }
    }

    public void restore(RateLimiterState state) {
        lock.lock();
        try {
            Instant now = clock.instant();
            hourly.restore(state.getHourlyCount(), state.getHourlyWindowStart(), now);
            burst.restore(state.getBurstCount(), state.getBurstWindowStart(), now);
            hourly.roll(now);
            burst.roll(now);
            dirty = false;
            log.debug("Restored rate limiter state: hourly={}, burst={}", hourly.count(), burst.count());
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            Instant now = clock.instant();
            hourly.reset(now);
            burst.reset(now);
            dirty = true;
        } finally {
            lock.unlock();
        }
    }

    public RateLimiterOccupancy occupancy() {
        lock.lock();
        try {
            Instant now = clock.instant();
            hourly.roll(now);
            burst.roll(now);
            return new RateLimiterOccupancy(hourly.count(), hourly.capacity(), hourly.windowStart(),
                    burst.count(), burst.capacity(), burst.windowStart());
        } finally {
            lock.unlock();
        }
    }

    private RateLimiterState toState(String stateId) {
        RateLimiterState state = new RateLimiterState();
        state.setId(stateId);
        state.setHourlyCount(hourly.count());
        state.setHourlyWindowStart(hourly.windowStart());
        state.setBurstCount(burst.count());
        state.setBurstWindowStart(burst.windowStart());
        state.setUpdatedAt(clock.instant());
        return state;
    }
}
