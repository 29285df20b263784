package com.rewardradar.client;

/**
 * Base type for failures talking to the rewards API.
 */
public class RewardsApiException extends RuntimeException {

    public RewardsApiException(String message) {
        super(message);
    }

    public RewardsApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
