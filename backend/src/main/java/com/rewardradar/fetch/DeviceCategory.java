package com.rewardradar.fetch;

import com.rewardradar.client.GridRewardsPeriod;

import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Which reward figure of a period a request asks for.
 */
public enum DeviceCategory {
    EV(GridRewardsPeriod::vehicleRewards),
    HOME_BATTERY(GridRewardsPeriod::batteryRewards),
    TOTAL(GridRewardsPeriod::totalReward);

    private final Function<GridRewardsPeriod, BigDecimal> extractor;

    DeviceCategory(Function<GridRewardsPeriod, BigDecimal> extractor) {
        this.extractor = extractor;
    }

    /** Amount for this category, or null when the API reported none. */
    public BigDecimal amountOf(GridRewardsPeriod period) {
        return extractor.apply(period);
    }
}
