package com.bluejay.certdiscovery.discovery.http;

import com.bluejay.certdiscovery.discovery.model.RateLimitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window limiter: at most {@code maxRequests} acquisitions in any trailing {@code window}.
 * One instance is shared by every outbound call of a discovery run.
 */
public class ScrapeRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(ScrapeRateLimiter.class);
    private static final long MIN_WAIT_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> issued = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition slotFreed = lock.newCondition();

    public ScrapeRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be >= 1");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public void acquire() throws InterruptedException {
        tryAcquire(null);
    }

    /**
     * Waits at most {@code maxWait} for a slot; a null {@code maxWait} waits as long as needed.
     *
     * @return false when no slot freed up within {@code maxWait}
     */
    public boolean tryAcquire(Duration maxWait) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            Instant giveUpAt = maxWait == null ? null : clock.instant().plus(maxWait);
            boolean logged = false;
            while (true) {
                Instant now = clock.instant();
                evictExpired(now);
                if (issued.size() < maxRequests) {
                    issued.addLast(now);
                    return true;
                }
                long waitNanos = Math.max(MIN_WAIT_NANOS, Duration.between(now, issued.peekFirst().plus(window)).toNanos());
                if (giveUpAt != null) {
                    long budgetNanos = Duration.between(now, giveUpAt).toNanos();
                    if (budgetNanos <= 0) {
                        return false;
                    }
                    waitNanos = Math.min(waitNanos, budgetNanos);
                }
                if (!logged) {
                    log.info("Rate limit reached ({} per {}s), waiting up to {} ms", maxRequests, window.toSeconds(),
                        TimeUnit.NANOSECONDS.toMillis(waitNanos));
                    logged = true;
                } else {
                    log.debug("Still waiting for a rate limit slot");
                }
                slotFreed.awaitNanos(waitNanos);
            }
        } finally {
            slotFreed.signal();
            lock.unlock();
        }
    }

    public RateLimitStatus status() {
        lock.lock();
        try {
            Instant now = clock.instant();
            evictExpired(now);
            int current = issued.size();
            double secondsUntilNext = 0.0;
            if (current >= maxRequests && !issued.isEmpty()) {
                Duration wait = Duration.between(now, issued.peekFirst().plus(window));
                secondsUntilNext = Math.max(0.0, wait.toMillis() / 1000.0);
            }
            return new RateLimitStatus(current, maxRequests, Math.max(0, maxRequests - current), secondsUntilNext);
        } finally {
            lock.unlock();
        }
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(window);
        while (!issued.isEmpty() && !issued.peekFirst().isAfter(cutoff)) {
            issued.pollFirst();
        }
    }
}
