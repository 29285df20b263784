package com.rewardradar.ratelimit;

import lombok.Getter;

import java.time.Duration;

/**
 * Outcome of {@link RateLimiter#tryAcquire()}: admitted, or denied with the wait before capacity frees.
 */
@Getter
public final class RateLimitDecision {

    private static final RateLimitDecision ADMITTED = new RateLimitDecision(true, Duration.ZERO);

    private final boolean admitted;
    private final Duration retryAfter;

    private RateLimitDecision(boolean admitted, Duration retryAfter) {
        this.admitted = admitted;
        this.retryAfter = retryAfter;
    }

    public static RateLimitDecision admitted() {
        return ADMITTED;
    }

    public static RateLimitDecision denied(Duration retryAfter) {
        return new RateLimitDecision(false, retryAfter);
    }

    @Override
    public String toString() {
        return admitted ? "Admitted" : "Denied(retryAfter=" + retryAfter + ")";
    }
}
