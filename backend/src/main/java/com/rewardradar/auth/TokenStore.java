package com.rewardradar.auth;

import com.rewardradar.client.AccessToken;
import com.rewardradar.client.Credentials;
import com.rewardradar.client.CredentialsInvalidException;
import com.rewardradar.client.FetchCancelledException;
import com.rewardradar.client.RemoteRateLimitedException;
import com.rewardradar.client.RetryExhaustedException;
import com.rewardradar.client.RewardsApiClient;
import com.rewardradar.client.TransientApiException;
import com.rewardradar.common.RetryPolicy;
import com.rewardradar.common.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the bearer token. Refresh is single-flight: callers that find the token unusable queue on one lock,
 * re-check, and only the first performs the credential exchange. Callers that queued behind a failed exchange
 * receive that failure instead of starting their own.
 */
@Slf4j
public class TokenStore {

    private final RewardsApiClient apiClient;
    private final Credentials credentials;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Duration tokenLifetime;
    private final Duration refreshBuffer;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile AccessToken token;
    private volatile Instant lastAuthenticatedAt;
    /** Completed credential exchanges; written under {@link #refreshLock}. */
    private volatile long refreshCount;
    /** Outcome of the latest exchange when it failed; guarded by {@link #refreshLock}. */
    private RuntimeException lastRefreshFailure;

    public TokenStore(RewardsApiClient apiClient, Credentials credentials, RetryPolicy retryPolicy,
                      Sleeper sleeper, Clock clock, Duration tokenLifetime, Duration refreshBuffer) {
        if (tokenLifetime.compareTo(refreshBuffer) <= 0) {
            throw new IllegalArgumentException("tokenLifetime must exceed refreshBuffer");
        }
        this.apiClient = apiClient;
        this.credentials = credentials;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.tokenLifetime = tokenLifetime;
        this.refreshBuffer = refreshBuffer;
    }

    /**
     * Token usable for at least the refresh buffer. Authenticates at most once for any number of concurrent callers.
     */
    public AccessToken getValidToken() {
        AccessToken current = token;
        if (isUsable(current)) {
            return current;
        }
        long seen = refreshCount;
        lockForRefresh();
        try {
            current = token;
            if (isUsable(current)) {
                log.debug("Using token obtained by concurrent request");
                return current;
            }
            rethrowFailureSince(seen);
            return refresh();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Replaces a token the API rejected. If another caller already replaced it, that token is returned without a new exchange.
     */
    public AccessToken refreshAfterRejection(AccessToken rejected) {
        long seen = refreshCount;
        lockForRefresh();
        try {
            AccessToken current = token;
            if (current != null && !current.equals(rejected) && isUsable(current)) {
                return current;
            }
            rethrowFailureSince(seen);
            invalidate();
            log.warn("Token rejected by API - re-authenticating {}", credentials.email());
            return refresh();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Drops the current token; the next caller authenticates.
     */
    public void invalidate() {
        token = null;
    }

    public Optional<Instant> lastAuthenticatedAt() {
        return Optional.ofNullable(lastAuthenticatedAt);
    }

    boolean isUsable(AccessToken candidate) {
        return candidate != null && candidate.isUsableAt(clock.instant(), refreshBuffer);
    }

    int queuedForRefresh() {
        return refreshLock.getQueueLength();
    }

    private void rethrowFailureSince(long seen) {
        if (refreshCount != seen && lastRefreshFailure != null) {
            log.debug("Sharing failure of concurrent authentication: {}", lastRefreshFailure.getMessage());
            throw lastRefreshFailure;
        }
    }

    /** Runs one exchange under the lock and records its outcome for queued callers. */
    private AccessToken refresh() {
        try {
            AccessToken fresh = authenticate();
            lastRefreshFailure = null;
            return fresh;
        } catch (FetchCancelledException e) {
            // cancellation belongs to this caller only
            lastRefreshFailure = null;
            throw e;
        } catch (RuntimeException e) {
            lastRefreshFailure = e;
            throw e;
        } finally {
            refreshCount++;
        }
    }

    private AccessToken authenticate() {
        credentials.validate();
        log.info("Token is missing or expired for {} - authenticating", credentials.email());
        RuntimeException lastCause = null;
        int maxAttempts = retryPolicy.getMaxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                String value = apiClient.login(credentials);
                Instant now = clock.instant();
                AccessToken fresh = new AccessToken(value, now.plus(tokenLifetime));
                token = fresh;
                lastAuthenticatedAt = now;
                log.info("Authenticated {} - token expires {}", credentials.email(), fresh.expiresAt());
                return fresh;
            } catch (CredentialsInvalidException e) {
                log.error("Authentication rejected for {}: {}", credentials.email(), e.getMessage());
                throw e;
            } catch (TransientApiException | RemoteRateLimitedException e) {
                lastCause = e;
                if (attempt < maxAttempts - 1) {
                    Duration wait = Duration.ofMillis(retryPolicy.delayMs(attempt));
                    if (e instanceof RemoteRateLimitedException limited) {
                        wait = limited.getRetryAfter().orElse(wait);
                    }
                    log.warn("Authentication network error: {}. Retrying in {} ms (attempt {}/{})",
                            e.getMessage(), wait.toMillis(), attempt + 1, maxAttempts);
                    pause(wait);
                }
            }
        }
        log.error("Authentication failed after {} attempts", maxAttempts);
        throw new RetryExhaustedException("authenticate", maxAttempts, lastCause);
    }

    private void lockForRefresh() {
        try {
            refreshLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchCancelledException("Interrupted waiting for token refresh", e);
        }
    }

    private void pause(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchCancelledException("Interrupted during authentication backoff", e);
        }
    }
}
