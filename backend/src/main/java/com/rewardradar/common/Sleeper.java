package com.rewardradar.common;

import java.time.Duration;

/**
 * Blocking pause used by backoff and rate-limit waits. Swapped out in tests to control time.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
