package com.rewardradar.retry;

public enum RetryEventType {
    BACKOFF,
    REMOTE_RATE_LIMITED,
    LOCAL_RATE_LIMIT_WAIT,
    FORCED_TOKEN_REFRESH,
    EXHAUSTED
}
