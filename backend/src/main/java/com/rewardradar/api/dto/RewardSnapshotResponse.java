package com.rewardradar.api.dto;

import com.rewardradar.fetch.DeviceCategory;
import com.rewardradar.fetch.FetchFailure;
import com.rewardradar.fetch.StandardPeriod;
import com.rewardradar.polling.RewardSnapshot;

import java.math.BigDecimal;
import java.time.Instant;

public record RewardSnapshotResponse(
        String name,
        StandardPeriod period,
        DeviceCategory category,
        BigDecimal amount,
        String currency,
        Instant periodFrom,
        Instant periodTo,
        Instant updatedAt,
        Instant lastAttemptAt,
        boolean stale,
        FetchFailure lastFailure,
        String lastFailureMessage) {

    public static RewardSnapshotResponse from(RewardSnapshot s) {
        return new RewardSnapshotResponse(s.slot().name(), s.slot().period(), s.slot().category(), s.amount(),
                s.currency(), s.periodFrom(), s.periodTo(), s.updatedAt(), s.lastAttemptAt(), s.isStale(),
                s.lastFailure(), s.lastFailureMessage());
    }
}
