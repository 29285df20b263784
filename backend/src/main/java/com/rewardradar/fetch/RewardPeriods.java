package com.rewardradar.fetch;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the standard request set: every {@link StandardPeriod} for every {@link DeviceCategory}.
 */
public class RewardPeriods {

    private final Clock clock;

    public RewardPeriods(Clock clock) {
        this.clock = clock;
    }

    public Map<RewardSlot, RewardPeriodRequest> standardPeriods(String homeId) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        Map<RewardSlot, RewardPeriodRequest> requests = new LinkedHashMap<>();
        for (StandardPeriod period : StandardPeriod.values()) {
            for (DeviceCategory category : DeviceCategory.values()) {
                requests.put(new RewardSlot(period, category), requestFor(homeId, period, category, today));
            }
        }
        return requests;
    }

    public RewardPeriodRequest request(String homeId, RewardSlot slot) {
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        return requestFor(homeId, slot.period(), slot.category(), today);
    }

    private static RewardPeriodRequest requestFor(String homeId, StandardPeriod period, DeviceCategory category,
                                                  LocalDate today) {
        return new RewardPeriodRequest(homeId, category, period.from(today), period.to(today));
    }
}
