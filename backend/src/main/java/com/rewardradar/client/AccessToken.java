package com.rewardradar.client;

import java.time.Duration;
import java.time.Instant;

/**
 * Bearer token with the instant it stops being accepted.
 */
public record AccessToken(String value, Instant expiresAt) {

    public AccessToken {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("token value required");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt required");
        }
    }

    /**
     * True while at least {@code refreshBuffer} of lifetime remains.
     */
    public boolean isUsableAt(Instant now, Duration refreshBuffer) {
        return now.isBefore(expiresAt.minus(refreshBuffer));
    }

    @Override
    public String toString() {
        return "AccessToken[expiresAt=" + expiresAt + "]";
    }
}
