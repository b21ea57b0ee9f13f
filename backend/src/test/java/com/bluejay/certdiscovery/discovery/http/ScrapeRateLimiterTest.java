package com.bluejay.certdiscovery.discovery.http;

import com.bluejay.certdiscovery.discovery.model.RateLimitStatus;
import com.bluejay.certdiscovery.testsupport.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScrapeRateLimiterTest {

    @Test
    void blocksOnceWindowIsFull() throws Exception {
        ScrapeRateLimiter limiter = new ScrapeRateLimiter(3, Duration.ofMillis(400), Clock.systemUTC());
        long start = System.nanoTime();
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(300);

        limiter.acquire();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(380);
    }

    @Test
    void tryAcquireGivesUpOnceWaitBudgetIsSpent() throws Exception {
        ScrapeRateLimiter limiter = new ScrapeRateLimiter(1, Duration.ofSeconds(60), Clock.systemUTC());
        assertThat(limiter.tryAcquire(Duration.ofMillis(10))).isTrue();

        long start = System.nanoTime();
        boolean acquired = limiter.tryAcquire(Duration.ofMillis(120));

        assertThat(acquired).isFalse();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(100);
        assertThat(limiter.status().currentRequests()).isEqualTo(1);
    }

    @Test
    void concurrentCallersNeverExceedWindowBudget() throws Exception {
        ScrapeRateLimiter limiter = new ScrapeRateLimiter(2, Duration.ofMillis(200), Clock.systemUTC());
        ExecutorService executor = Executors.newFixedThreadPool(6);
        List<Long> acquiredAt = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch ready = new CountDownLatch(1);
        long start = System.nanoTime();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                futures.add(executor.submit(() -> {
                    ready.await();
                    limiter.acquire();
                    acquiredAt.add(System.nanoTime());
                    return null;
                }));
            }
            ready.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Six calls at two per window need at least two full windows.
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(380);
        List<Long> sorted = new ArrayList<>(acquiredAt);
        Collections.sort(sorted);
        assertThat(sorted).hasSize(6);
        for (int i = 2; i < sorted.size(); i++) {
            long gapMs = TimeUnit.NANOSECONDS.toMillis(sorted.get(i) - sorted.get(i - 2));
            assertThat(gapMs).isGreaterThanOrEqualTo(150);
        }
    }

    @Test
    void statusReportsUsageAndFreesSlotsAfterWindow() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        ScrapeRateLimiter limiter = new ScrapeRateLimiter(5, Duration.ofSeconds(60), clock);
        limiter.acquire();
        limiter.acquire();

        RateLimitStatus partial = limiter.status();
        assertThat(partial.currentRequests()).isEqualTo(2);
        assertThat(partial.remainingRequests()).isEqualTo(3);
        assertThat(partial.secondsUntilNextSlot()).isEqualTo(0.0);

        limiter.acquire();
        limiter.acquire();
        clock.advance(Duration.ofSeconds(15));
        limiter.acquire();
        RateLimitStatus full = limiter.status();
        assertThat(full.remainingRequests()).isZero();
        assertThat(full.secondsUntilNextSlot()).isEqualTo(45.0);

        clock.advance(Duration.ofSeconds(45));
        RateLimitStatus drained = limiter.status();
        assertThat(drained.currentRequests()).isEqualTo(1);
        assertThat(drained.maxRequests()).isEqualTo(5);
    }

    @Test
    void waitingCallerCanBeInterrupted() throws Exception {
        ScrapeRateLimiter limiter = new ScrapeRateLimiter(1, Duration.ofSeconds(60), Clock.systemUTC());
        limiter.acquire();
        AtomicBoolean interrupted = new AtomicBoolean(false);
        Thread waiter = new Thread(() -> {
            try {
                limiter.acquire();
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        waiter.start();
        Thread.sleep(100);
        waiter.interrupt();
        waiter.join(2000);

        assertThat(waiter.isAlive()).isFalse();
        assertThat(interrupted).isTrue();
        assertThat(limiter.status().currentRequests()).isEqualTo(1);
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThatThrownBy(() -> new ScrapeRateLimiter(0, Duration.ofSeconds(1), Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScrapeRateLimiter(1, Duration.ZERO, Clock.systemUTC()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
