package com.rewardradar.retry;

import com.rewardradar.auth.TokenStore;
import com.rewardradar.client.AccessToken;
import com.rewardradar.client.FetchCancelledException;
import com.rewardradar.client.RemoteRateLimitedException;
import com.rewardradar.client.RetryExhaustedException;
import com.rewardradar.client.TransientApiException;
import com.rewardradar.client.UnauthorizedException;
import com.rewardradar.common.RetryPolicy;
import com.rewardradar.common.Sleeper;
import com.rewardradar.ratelimit.RateLimitDecision;
import com.rewardradar.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;

/**
 * Runs one API operation under the retry policy.
 * <ul>
 *   <li>every attempt first takes a rate limiter permit; a denial waits {@code retryAfter} and does not use up an attempt</li>
 *   <li>transport errors and 5xx back off exponentially with jitter, up to {@code maxAttempts}</li>
 *   <li>the first 401 of a call forces one token refresh and retries outside the attempt count</li>
 *   <li>a 429 waits for Retry-After (or the backoff delay) and counts as an attempt</li>
 * </ul>
 * Credential and query errors propagate immediately.
 */
@Slf4j
public class RetryExecutor {

    private final TokenStore tokenStore;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final RetryEventLog eventLog;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryExecutor(TokenStore tokenStore, RateLimiter rateLimiter, RetryPolicy retryPolicy,
                         RetryEventLog eventLog, Sleeper sleeper, Clock clock) {
        this.tokenStore = tokenStore;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.eventLog = eventLog;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public <T> T execute(String operationName, ApiOperation<T> operation) {
        int maxAttempts = retryPolicy.getMaxAttempts();
        int attempt = 0;
        boolean forcedRefreshUsed = false;
        RuntimeException lastCause = null;
        while (attempt < maxAttempts) {
            awaitPermit(operationName, attempt);
            AccessToken token = tokenStore.getValidToken();
            try {
                return operation.call(token);
            } catch (UnauthorizedException e) {
                lastCause = e;
                if (!forcedRefreshUsed) {
                    forcedRefreshUsed = true;
                    record(operationName, RetryEventType.FORCED_TOKEN_REFRESH, attempt, Duration.ZERO, e);
                    tokenStore.refreshAfterRejection(token);
                    continue;
                }
                attempt++;
                backoff(operationName, attempt, maxAttempts, e);
            } catch (RemoteRateLimitedException e) {
                lastCause = e;
                attempt++;
                if (attempt < maxAttempts) {
                    long backoffMs = retryPolicy.delayMs(attempt - 1);
                    Duration wait = e.getRetryAfter().orElse(Duration.ofMillis(backoffMs));
                    log.warn("{}: rate limited by API (429). Waiting {} ms before attempt {}/{}",
                            operationName, wait.toMillis(), attempt + 1, maxAttempts);
                    record(operationName, RetryEventType.REMOTE_RATE_LIMITED, attempt, wait, e);
                    pause(wait);
                }
            } catch (TransientApiException e) {
                lastCause = e;
                attempt++;
                backoff(operationName, attempt, maxAttempts, e);
            }
        }
        record(operationName, RetryEventType.EXHAUSTED, attempt, Duration.ZERO, lastCause);
        log.error("{}: giving up after {} attempts: {}", operationName, attempt,
                lastCause != null ? lastCause.getMessage() : "unknown");
        throw new RetryExhaustedException(operationName, attempt, lastCause);
    }

    private void backoff(String operationName, int failedAttempts, int maxAttempts, RuntimeException cause) {
        if (failedAttempts >= maxAttempts) {
            return;
        }
        Duration wait = Duration.ofMillis(retryPolicy.delayMs(failedAttempts - 1));
        log.warn("{}: {} - retrying in {} ms (attempt {}/{})", operationName, cause.getMessage(),
                wait.toMillis(), failedAttempts + 1, maxAttempts);
        record(operationName, RetryEventType.BACKOFF, failedAttempts, wait, cause);
        pause(wait);
    }

    private void awaitPermit(String operationName, int attempt) {
        RateLimitDecision decision = rateLimiter.tryAcquire();
        while (!decision.isAdmitted()) {
            Duration wait = decision.getRetryAfter();
            log.debug("{}: local rate limit reached, waiting {} ms", operationName, wait.toMillis());
            record(operationName, RetryEventType.LOCAL_RATE_LIMIT_WAIT, attempt, wait, null);
            pause(wait);
            decision = rateLimiter.tryAcquire();
        }
    }

    private void pause(Duration wait) {
        if (Thread.currentThread().isInterrupted()) {
            throw new FetchCancelledException("Fetch cancelled", new InterruptedException());
        }
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchCancelledException("Fetch cancelled while waiting", e);
        }
    }

    private void record(String operationName, RetryEventType type, int attempt, Duration delay, Throwable cause) {
        String reason = cause == null ? null
                : cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        eventLog.record(new RetryEvent(clock.instant(), operationName, type, attempt, delay, reason));
    }
}
