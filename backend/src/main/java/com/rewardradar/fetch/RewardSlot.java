package com.rewardradar.fetch;

/**
 * A polled value: one standard period for one category.
 */
public record RewardSlot(StandardPeriod period, DeviceCategory category) {

    public String name() {
        return period.name().toLowerCase() + "." + category.name().toLowerCase();
    }
}
