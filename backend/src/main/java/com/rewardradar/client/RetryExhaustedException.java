package com.rewardradar.client;

/**
 * All attempts of an operation failed. The cause is the last underlying failure.
 */
public class RetryExhaustedException extends RewardsApiException {

    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastCause) {
        super(operation + " failed after " + attempts + " attempts: " + messageOf(lastCause), lastCause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String messageOf(Throwable e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
