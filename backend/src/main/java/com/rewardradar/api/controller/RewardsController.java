package com.rewardradar.api.controller;

import com.rewardradar.api.dto.ErrorBody;
import com.rewardradar.api.dto.RewardSnapshotResponse;
import com.rewardradar.api.dto.RewardsRefreshRequest;
import com.rewardradar.fetch.DeviceCategory;
import com.rewardradar.fetch.RewardSlot;
import com.rewardradar.fetch.StandardPeriod;
import com.rewardradar.polling.RewardSnapshot;
import com.rewardradar.polling.RewardSnapshotHolder;
import com.rewardradar.polling.RewardsPollJob;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * GET /rewards (last known values), POST /rewards/refresh (manual refresh of all or some slots).
 * Refreshes block on remote calls, so they run on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/rewards")
@RequiredArgsConstructor
public class RewardsController {

    private final RewardsPollJob rewardsPollJob;
    private final RewardSnapshotHolder snapshotHolder;

    @GetMapping
    public List<RewardSnapshotResponse> rewards() {
        return snapshotHolder.all().stream().map(RewardSnapshotResponse::from).toList();
    }

    @PostMapping("/refresh")
    public Mono<ResponseEntity<?>> refresh(@RequestBody(required = false) RewardsRefreshRequest request) {
        List<RewardSlot> slots = slotsFor(request);
        return Mono.<ResponseEntity<?>>fromCallable(() -> refreshSlots(slots))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ResponseEntity<?> refreshSlots(List<RewardSlot> slots) {
        List<RewardSnapshotResponse> refreshed = new ArrayList<>();
        for (RewardSlot slot : slots) {
            Optional<RewardSnapshot> snapshot = rewardsPollJob.refreshSlot(slot);
            if (snapshot.isEmpty()) {
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .body(ErrorBody.of("NO_HOME", "No home configured or found on the account"));
            }
            refreshed.add(RewardSnapshotResponse.from(snapshot.get()));
        }
        return ResponseEntity.ok(refreshed);
    }

    private static List<RewardSlot> slotsFor(RewardsRefreshRequest request) {
        List<StandardPeriod> periods = request == null || request.period() == null
                ? List.of(StandardPeriod.values()) : List.of(request.period());
        List<DeviceCategory> categories = request == null || request.category() == null
                ? List.of(DeviceCategory.values()) : List.of(request.category());
        List<RewardSlot> slots = new ArrayList<>();
        for (StandardPeriod period : periods) {
            for (DeviceCategory category : categories) {
                slots.add(new RewardSlot(period, category));
            }
        }
        return slots;
    }
}
