package com.rewardradar.fetch;

import com.rewardradar.common.Redaction;

import java.time.Instant;
import java.util.regex.Pattern;

/**
 * One unit of orchestrator work: a home, a category and the half-open period [from, to).
 */
public record RewardPeriodRequest(String homeId, DeviceCategory category, Instant from, Instant to) {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    /**
     * @throws InvalidPeriodRequestException if the home id is not a UUID or the period is empty
     */
    public void validate() {
        if (homeId == null || !UUID_PATTERN.matcher(homeId).matches()) {
            throw new InvalidPeriodRequestException("Invalid home ID format");
        }
        if (category == null) {
            throw new InvalidPeriodRequestException("category is required");
        }
        if (from == null || to == null || !from.isBefore(to)) {
            throw new InvalidPeriodRequestException("Start date must be before end date");
        }
    }

    public String label() {
        return category + "@" + Redaction.shortId(homeId) + "[" + from + ", " + to + ")";
    }
}
