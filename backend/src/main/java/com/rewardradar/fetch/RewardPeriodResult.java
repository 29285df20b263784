package com.rewardradar.fetch;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Outcome of one period fetch: an amount with currency and the bounds the API reported, or a typed failure.
 */
public record RewardPeriodResult(
        BigDecimal amount,
        String currency,
        Instant periodFrom,
        Instant periodTo,
        FetchFailure failure,
        String message) {

    public static RewardPeriodResult success(BigDecimal amount, String currency, Instant periodFrom, Instant periodTo) {
        return new RewardPeriodResult(amount, currency, periodFrom, periodTo, null, null);
    }

    public static RewardPeriodResult failure(FetchFailure failure, String message) {
        return new RewardPeriodResult(null, null, null, null, failure, message);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
