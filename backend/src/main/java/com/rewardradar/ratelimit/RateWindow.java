package com.rewardradar.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-capacity counter over a window that restarts when its length has elapsed since windowStart.
 * Not thread-safe; {@link RateLimiter} guards it.
 */
class RateWindow {

    private final int capacity;
    private final Duration length;
    private int count;
    private Instant windowStart;

    RateWindow(String name, int capacity, Duration length, Instant windowStart) {
        if (capacity <= 0) {
            throw new IllegalArgumentException(name + " capacity must be positive");
        }
        if (length.isZero() || length.isNegative()) {
            throw new IllegalArgumentException(name + " window length must be positive");
        }
        this.capacity = capacity;
        this.length = length;
        this.windowStart = windowStart;
    }

    void roll(Instant now) {
        if (Duration.between(windowStart, now).compareTo(length) >= 0) {
            count = 0;
            windowStart = now;
        }
    }

    boolean hasCapacity() {
        return count < capacity;
    }

    void increment() {
        count++;
    }

    Duration untilReset(Instant now) {
        Duration remaining = Duration.between(now, windowStart.plus(length));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    void restore(int restoredCount, Instant restoredStart, Instant now) {
        this.count = Math.max(0, Math.min(capacity, restoredCount));
        this.windowStart = restoredStart == null || restoredStart.isAfter(now) ? now : restoredStart;
    }

    void reset(Instant now) {
        count = 0;
        windowStart = now;
    }

    int count() {
        return count;
    }

    int capacity() {
        return capacity;
    }

    Instant windowStart() {
        return windowStart;
    }
}
