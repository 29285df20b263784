package com.rewardradar.polling;

import com.rewardradar.common.Redaction;
import com.rewardradar.fetch.FetchFailure;
import com.rewardradar.fetch.FetchOrchestrator;
import com.rewardradar.fetch.RewardPeriodRequest;
import com.rewardradar.fetch.RewardPeriodResult;
import com.rewardradar.fetch.RewardPeriods;
import com.rewardradar.fetch.RewardSlot;
import com.rewardradar.polling.config.PollingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Periodic rewards poll. Fetches every standard slot and records results in {@link RewardSnapshotHolder}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RewardsPollJob {

    private final FetchOrchestrator fetchOrchestrator;
    private final RewardPeriods rewardPeriods;
    private final RewardSnapshotHolder snapshotHolder;
    private final HomeSelection homeSelection;
    private final PollingProperties pollingProperties;
    private final Clock clock;

    @Scheduled(
            fixedRateString = "${rewardradar.polling.rewards-interval-ms:900000}",
            initialDelayString = "${rewardradar.polling.rewards-initial-delay-ms:10000}")
    public void runScheduled() {
        if (!pollingProperties.isEnabled()) {
            return;
        }
        pollRewards();
    }

    public PollSummary pollRewards() {
        Optional<String> homeId = homeSelection.homeId();
        if (homeId.isEmpty()) {
            log.warn("Rewards poll skipped: no home available");
            return PollSummary.skipped();
        }
        Map<RewardSlot, RewardPeriodRequest> slots = rewardPeriods.standardPeriods(homeId.get());
        Map<RewardPeriodRequest, RewardPeriodResult> results = fetchOrchestrator.fetchAll(slots.values());
        Instant now = clock.instant();
        int succeeded = 0;
        int failed = 0;
        boolean credentialsInvalid = false;
        for (Map.Entry<RewardSlot, RewardPeriodRequest> slot : slots.entrySet()) {
            RewardPeriodResult result = results.get(slot.getValue());
            snapshotHolder.update(slot.getKey(), result, now);
            if (result.isSuccess()) {
                succeeded++;
            } else {
                failed++;
                credentialsInvalid |= result.failure() == FetchFailure.CREDENTIALS_INVALID;
                log.debug("Slot {} failed: {} {}", slot.getKey().name(), result.failure(), result.message());
            }
        }
        if (credentialsInvalid) {
            log.error("Rewards poll for home {}: credentials rejected, update rewardradar.api.email/password",
                    Redaction.shortId(homeId.get()));
        } else if (failed > 0) {
            log.warn("Rewards poll for home {}: {} of {} slots failed, keeping last known values",
                    Redaction.shortId(homeId.get()), failed, slots.size());
        } else {
            log.info("Rewards poll for home {}: {} slots updated", Redaction.shortId(homeId.get()), succeeded);
        }
        return new PollSummary(slots.size(), succeeded, failed, credentialsInvalid);
    }

    /**
     * Refreshes one slot on the calling thread. Empty when no home is available.
     */
    public Optional<RewardSnapshot> refreshSlot(RewardSlot slot) {
        return homeSelection.homeId().map(homeId -> {
            RewardPeriodResult result = fetchOrchestrator.fetchOne(rewardPeriods.request(homeId, slot));
            return snapshotHolder.update(slot, result, clock.instant());
        });
    }
}
