package com.rewardradar.polling;

import com.rewardradar.fetch.RewardPeriodResult;
import com.rewardradar.fetch.RewardSlot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest reward values per slot, read by the REST layer and written by polls and manual refreshes.
 */
@Component
public class RewardSnapshotHolder {

    private final Map<RewardSlot, RewardSnapshot> snapshots = new ConcurrentHashMap<>();

    public RewardSnapshot update(RewardSlot slot, RewardPeriodResult result, Instant attemptedAt) {
        return snapshots.compute(slot, (s, previous) -> {
            if (result.isSuccess()) {
                return new RewardSnapshot(s, result.amount(), result.currency(), result.periodFrom(),
                        result.periodTo(), attemptedAt, attemptedAt, null, null);
            }
            if (previous == null) {
                return new RewardSnapshot(s, null, null, null, null, null, attemptedAt,
                        result.failure(), result.message());
            }
            return new RewardSnapshot(s, previous.amount(), previous.currency(), previous.periodFrom(),
                    previous.periodTo(), previous.updatedAt(), attemptedAt, result.failure(), result.message());
        });
    }

    public Optional<RewardSnapshot> get(RewardSlot slot) {
        return Optional.ofNullable(snapshots.get(slot));
    }

    public List<RewardSnapshot> all() {
        return snapshots.values().stream()
                .sorted(Comparator.comparing((RewardSnapshot s) -> s.slot().period())
                        .thenComparing(s -> s.slot().category()))
                .toList();
    }
}
