package com.rewardradar.client;

/**
 * Transport error, timeout or HTTP 5xx. Retried with backoff.
 */
public class TransientApiException extends RewardsApiException {

    public TransientApiException(String message) {
        super(message);
    }

    public TransientApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
