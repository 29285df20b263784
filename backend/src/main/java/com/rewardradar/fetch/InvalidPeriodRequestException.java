package com.rewardradar.fetch;

/**
 * Request rejected before any network call (malformed home id, empty period).
 */
public class InvalidPeriodRequestException extends IllegalArgumentException {

    public InvalidPeriodRequestException(String message) {
        super(message);
    }
}
