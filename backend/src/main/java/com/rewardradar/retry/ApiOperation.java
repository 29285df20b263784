package com.rewardradar.retry;

import com.rewardradar.client.AccessToken;

/**
 * A single idempotent API call made with the current token.
 */
@FunctionalInterface
public interface ApiOperation<T> {

    T call(AccessToken token);
}
