package com.rewardradar.polling;

/**
 * Counts from one rewards poll.
 */
public record PollSummary(int periods, int succeeded, int failed, boolean credentialsInvalid) {

    public static PollSummary skipped() {
        return new PollSummary(0, 0, 0, false);
    }
}
