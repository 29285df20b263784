package com.rewardradar.polling;

import com.rewardradar.fetch.FetchFailure;
import com.rewardradar.fetch.RewardSlot;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Last known value of a slot. After a failed poll the previous value stays, with {@code lastFailure} set.
 *
 * @param updatedAt instant of the last successful fetch, null if there never was one
 */
public record RewardSnapshot(
        RewardSlot slot,
        BigDecimal amount,
        String currency,
        Instant periodFrom,
        Instant periodTo,
        Instant updatedAt,
        Instant lastAttemptAt,
        FetchFailure lastFailure,
        String lastFailureMessage) {

    public boolean hasValue() {
        return amount != null;
    }

    /** True when the value shown is older than the last attempt. */
    public boolean isStale() {
        return lastFailure != null;
    }
}
