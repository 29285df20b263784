package com.rewardradar.common;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff capped at a maximum delay, with symmetric jitter.
 * Shared by the request retry loop and the credential exchange.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterRatio;

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, double jitterRatio) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("delays must satisfy 0 <= baseDelayMs <= maxDelayMs");
        }
        if (jitterRatio < 0 || jitterRatio >= 1) {
            throw new IllegalArgumentException("jitterRatio must be in [0, 1)");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterRatio = jitterRatio;
    }

    /**
     * Un-jittered delay for the given zero-based attempt: min(baseDelay * 2^attempt, maxDelay).
     */
    public long cappedDelayMs(int attempt) {
        if (attempt <= 0) {
            return baseDelayMs;
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return Math.min(exponential, maxDelayMs);
    }

    /**
     * Jittered delay in milliseconds for the given zero-based attempt.
     */
    public long delayMs(int attempt) {
        return delayMs(attempt, ThreadLocalRandom.current());
    }

    public long delayMs(int attempt, Random random) {
        long capped = cappedDelayMs(attempt);
        double factor = 1.0 + (random.nextDouble() * 2.0 - 1.0) * jitterRatio;
        return Math.max(0, Math.round(capped * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    /**
     * Default: 3 attempts, 1s base, 60s cap, ±30% jitter.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, 1000L, 60_000L, 0.3);
    }
}
