package com.rewardradar.ratelimit;

import com.rewardradar.domain.RateLimiterState;
import com.rewardradar.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private final MutableClock clock = MutableClock.at("2024-05-10T12:00:00Z");

    @Test
    @DisplayName("admits up to burst capacity, then denies with time until the burst window resets")
    void burstCapacity_thenDenied() {
        RateLimiter limiter = new RateLimiter(80, 3, Duration.ofMinutes(15), clock);
        for (int i = 0; i < 3; i++) {
            assertThat(limiter.tryAcquire().isAdmitted()).isTrue();
        }
        clock.advance(Duration.ofMinutes(5));
        RateLimitDecision denied = limiter.tryAcquire();
        assertThat(denied.isAdmitted()).isFalse();
        assertThat(denied.getRetryAfter()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("denial does not change counters")
    void denial_leavesCountersUntouched() {
        RateLimiter limiter = new RateLimiter(80, 2, Duration.ofMinutes(15), clock);
        limiter.tryAcquire();
        limiter.tryAcquire();
        limiter.tryAcquire();
        limiter.tryAcquire();
        RateLimiterOccupancy occupancy = limiter.occupancy();
        assertThat(occupancy.burstCount()).isEqualTo(2);
        assertThat(occupancy.hourlyCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("burst window rolls over once its length has elapsed")
    void burstWindow_rollsOver() {
        RateLimiter limiter = new RateLimiter(80, 2, Duration.ofMinutes(15), clock);
        limiter.tryAcquire();
        limiter.tryAcquire();
        assertThat(limiter.tryAcquire().isAdmitted()).isFalse();
        clock.advance(Duration.ofMinutes(15));
        assertThat(limiter.tryAcquire().isAdmitted()).isTrue();
        assertThat(limiter.occupancy().burstCount()).isEqualTo(1);
        assertThat(limiter.occupancy().hourlyCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("hourly window caps admissions even when the burst window has room")
    void hourlyWindow_caps() {
        RateLimiter limiter = new RateLimiter(4, 2, Duration.ofMinutes(15), clock);
        int admitted = 0;
        for (int step = 0; step < 4; step++) {
            for (int i = 0; i < 2; i++) {
                if (limiter.tryAcquire().isAdmitted()) {
                    admitted++;
                }
            }
            clock.advance(Duration.ofMinutes(15));
        }
        assertThat(admitted).isEqualTo(4);
        assertThat(limiter.tryAcquire().isAdmitted()).as("first request of the next hour").isTrue();
    }

    @Test
    @DisplayName("when both windows are full, retryAfter points at the nearer reset and the caller asks again")
    void bothFull_retryAfterIsNearerReset() {
        RateLimiter limiter = new RateLimiter(2, 2, Duration.ofMinutes(15), clock);
        limiter.tryAcquire();
        limiter.tryAcquire();
        clock.advance(Duration.ofMinutes(10));

        RateLimitDecision denied = limiter.tryAcquire();
        assertThat(denied.isAdmitted()).isFalse();
        assertThat(denied.getRetryAfter()).isEqualTo(Duration.ofMinutes(5));

        clock.advance(denied.getRetryAfter());
        RateLimitDecision stillDenied = limiter.tryAcquire();
        assertThat(stillDenied.isAdmitted()).isFalse();
        assertThat(stillDenied.getRetryAfter()).isEqualTo(Duration.ofMinutes(45));
        assertThat(limiter.occupancy().burstCount()).isZero();
    }

    @Test
    @DisplayName("concurrent callers never exceed capacity")
    void concurrentCallers_neverExceedCapacity() throws InterruptedException {
        RateLimiter limiter = new RateLimiter(80, 20, Duration.ofMinutes(15), clock);
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger admitted = new AtomicInteger();
        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 10; i++) {
                        if (limiter.tryAcquire().isAdmitted()) {
                            admitted.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            }).start();
        }
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(admitted.get()).isEqualTo(20);
        assertThat(limiter.occupancy().burstCount()).isEqualTo(20);
    }

    @Test
    @DisplayName("restored state with 58 of 60 used mid-window allows exactly 2 more")
    void restore_midWindow_keepsExhaustion() {
        RateLimiter limiter = new RateLimiter(60, 60, Duration.ofMinutes(15), clock);
        RateLimiterState state = new RateLimiterState();
        state.setHourlyCount(58);
        state.setHourlyWindowStart(clock.instant().minus(Duration.ofMinutes(20)));
        state.setBurstCount(10);
        state.setBurstWindowStart(clock.instant().minus(Duration.ofMinutes(5)));
        limiter.restore(state);

        assertThat(limiter.tryAcquire().isAdmitted()).isTrue();
        assertThat(limiter.tryAcquire().isAdmitted()).isTrue();
        RateLimitDecision denied = limiter.tryAcquire();
        assertThat(denied.isAdmitted()).isFalse();
        assertThat(denied.getRetryAfter()).isEqualTo(Duration.ofMinutes(40));
    }

    @Test
    @DisplayName("restored counts are clamped and future window starts replaced by now")
    void restore_clampsInvalidState() {
        RateLimiter limiter = new RateLimiter(60, 20, Duration.ofMinutes(15), clock);
        RateLimiterState state = new RateLimiterState();
        state.setHourlyCount(500);
        state.setHourlyWindowStart(clock.instant().plus(Duration.ofHours(3)));
        state.setBurstCount(-4);
        state.setBurstWindowStart(null);
        limiter.restore(state);

        RateLimiterOccupancy occupancy = limiter.occupancy();
        assertThat(occupancy.hourlyCount()).isEqualTo(60);
        assertThat(occupancy.hourlyWindowStart()).isEqualTo(clock.instant());
        assertThat(occupancy.burstCount()).isZero();
        assertThat(occupancy.burstWindowStart()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("restored window that already expired starts fresh")
    void restore_expiredWindow_resets() {
        RateLimiter limiter = new RateLimiter(60, 20, Duration.ofMinutes(15), clock);
        RateLimiterState state = new RateLimiterState();
        state.setHourlyCount(60);
        state.setHourlyWindowStart(clock.instant().minus(Duration.ofHours(2)));
        state.setBurstCount(20);
        state.setBurstWindowStart(clock.instant().minus(Duration.ofHours(2)));
        limiter.restore(state);

        assertThat(limiter.tryAcquire().isAdmitted()).isTrue();
    }

    @Test
    @DisplayName("snapshotIfDirty is empty until something is admitted, then clears the flag")
    void snapshotIfDirty_tracksChanges() {
        RateLimiter limiter = new RateLimiter(60, 20, Duration.ofMinutes(15), clock);
        assertThat(limiter.snapshotIfDirty("acc")).isEmpty();
        limiter.tryAcquire();
        RateLimiterState state = limiter.snapshotIfDirty("acc").orElseThrow();
        assertThat(state.getId()).isEqualTo("acc");
        assertThat(state.getHourlyCount()).isEqualTo(1);
        assertThat(state.getUpdatedAt()).isEqualTo(Instant.parse("2024-05-10T12:00:00Z"));
        assertThat(limiter.snapshotIfDirty("acc")).isEmpty();
    }

    @Test
    @DisplayName("reset empties both windows")
    void reset_emptiesWindows() {
        RateLimiter limiter = new RateLimiter(60, 2, Duration.ofMinutes(15), clock);
        limiter.tryAcquire();
        limiter.tryAcquire();
        limiter.reset();
        assertThat(limiter.occupancy().burstCount()).isZero();
        assertThat(limiter.tryAcquire().isAdmitted()).isTrue();
    }

    @Test
    @DisplayName("constructor rejects non-positive capacity")
    void constructor_rejectsNonPositive() {
        assertThatThrownBy(() -> new RateLimiter(0, 20, Duration.ofMinutes(15), clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("positive");
    }
}
