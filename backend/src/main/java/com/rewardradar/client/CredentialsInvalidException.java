package com.rewardradar.client;

/**
 * Login was rejected or the configured credentials are malformed. Never retried; needs operator action.
 */
public class CredentialsInvalidException extends RewardsApiException {

    public CredentialsInvalidException(String message) {
        super(message);
    }
}
