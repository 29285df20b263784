package com.rewardradar.retry;

import java.time.Duration;
import java.time.Instant;

/**
 * One retry decision, kept for diagnostics.
 */
public record RetryEvent(Instant at, String operation, RetryEventType type, int attempt, Duration delay, String reason) {
}
