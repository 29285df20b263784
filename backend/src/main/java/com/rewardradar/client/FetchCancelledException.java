package com.rewardradar.client;

/**
 * The calling thread was interrupted (shutdown or reconfiguration) while waiting or in flight.
 */
public class FetchCancelledException extends RewardsApiException {

    public FetchCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
