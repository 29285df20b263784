package com.rewardradar.client;

import java.time.Duration;
import java.util.Optional;

/**
 * The API answered HTTP 429. Carries the Retry-After hint when the server sent one.
 */
public class RemoteRateLimitedException extends RewardsApiException {

    private final Duration retryAfter;

    public RemoteRateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
