package com.rewardradar.fetch;

/**
 * Why a period fetch produced no value. Only CREDENTIALS_INVALID needs an operator; the rest heal on a later tick.
 */
public enum FetchFailure {
    CREDENTIALS_INVALID,
    RETRY_EXHAUSTED,
    CANCELLED,
    QUERY_FAILED,
    INVALID_REQUEST,
    UNEXPECTED_ERROR
}
