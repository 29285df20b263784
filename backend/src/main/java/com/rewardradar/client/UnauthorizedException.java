package com.rewardradar.client;

/**
 * The API rejected the bearer token (HTTP 401), typically because it expired mid-flight.
 */
public class UnauthorizedException extends RewardsApiException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
