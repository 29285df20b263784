package com.rewardradar.client;

/**
 * The API answered but the query failed: GraphQL errors, a 4xx other than 401/429, or an unusable payload.
 * Re-issuing the same request would not help, so it is not retried.
 */
public class RewardsQueryException extends RewardsApiException {

    public RewardsQueryException(String message) {
        super(message);
    }

    public RewardsQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
