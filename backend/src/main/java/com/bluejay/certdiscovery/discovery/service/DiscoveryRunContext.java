package com.bluejay.certdiscovery.discovery.service;

import com.bluejay.certdiscovery.discovery.http.CallGuard;
import com.bluejay.certdiscovery.discovery.http.RateLimitedScrapingClient;
import com.bluejay.certdiscovery.discovery.model.CertificationQuery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Everything one discovery run needs, built once and handed to every phase.
 */
public class DiscoveryRunContext implements CallGuard {
    private final String runId;
    private final CertificationQuery query;
    private final DiscoverySettings settings;
    private final RateLimitedScrapingClient client;
    private final Clock clock;
    private final Instant startedAt;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public DiscoveryRunContext(
        String runId,
        CertificationQuery query,
        DiscoverySettings settings,
        RateLimitedScrapingClient client,
        Clock clock
    ) {
        this.runId = runId;
        this.query = query;
        this.settings = settings;
        this.client = client;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.deadline = settings.hasRunTimeout() ? startedAt.plus(settings.runTimeout()) : null;
    }

    public String runId() {
        return runId;
    }

    public CertificationQuery query() {
        return query;
    }

    public DiscoverySettings settings() {
        return settings;
    }

    public RateLimitedScrapingClient client() {
        return client;
    }

    public Clock clock() {
        return clock;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant deadline() {
        return deadline;
    }

    public boolean deadlinePassed() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    /**
     * Time left before the run deadline, or null when the run has none.
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public boolean stopped() {
        return isCancelled() || deadlinePassed();
    }

    @Override
    public Duration waitBudget() {
        return remaining();
    }
}
