package com.bluejay.certdiscovery.discovery.http;

import com.bluejay.certdiscovery.discovery.model.PageContent;
import com.bluejay.certdiscovery.discovery.scrape.CrawlPage;
import com.bluejay.certdiscovery.discovery.scrape.CrawlRequest;
import com.bluejay.certdiscovery.discovery.scrape.FetchOptions;
import com.bluejay.certdiscovery.discovery.scrape.MapLink;
import com.bluejay.certdiscovery.discovery.scrape.ScrapeOutcome;
import com.bluejay.certdiscovery.discovery.scrape.ScrapingClient;

import java.util.List;
import java.util.function.Supplier;

/**
 * Takes one limiter slot before every delegated call.
 */
public class RateLimitedScrapingClient implements ScrapingClient {
    public static final String STOPPED = "run_stopped";

    private final ScrapingClient delegate;
    private final ScrapeRateLimiter limiter;

    public RateLimitedScrapingClient(ScrapingClient delegate, ScrapeRateLimiter limiter) {
        this.delegate = delegate;
        this.limiter = limiter;
    }

    @Override
    public ScrapeOutcome<List<MapLink>> map(String url, String search, int limit) {
        return gated(() -> delegate.map(url, search, limit));
    }

    @Override
    public ScrapeOutcome<List<CrawlPage>> crawl(CrawlRequest request) {
        return gated(() -> delegate.crawl(request));
    }

    @Override
    public ScrapeOutcome<PageContent> fetch(String url, List<String> formats, FetchOptions options) {
        return gated(() -> delegate.fetch(url, formats, options));
    }

    /**
     * Fetch that gives up with {@link #STOPPED} when the guard stops the call before or after the
     * slot wait, or when no slot frees up within the guard's wait budget.
     */
    public ScrapeOutcome<PageContent> fetch(String url, List<String> formats, FetchOptions options, CallGuard guard) {
        if (guard.stopped()) {
            return ScrapeOutcome.failure(STOPPED, "stopped before waiting for a rate limit slot");
        }
        try {
            if (!limiter.tryAcquire(guard.waitBudget())) {
                return ScrapeOutcome.failure(STOPPED, "no rate limit slot within the run deadline");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ScrapeOutcome.failure("interrupted", "interrupted while waiting for a rate limit slot");
        }
        if (guard.stopped()) {
            return ScrapeOutcome.failure(STOPPED, "stopped while waiting for a rate limit slot");
        }
        return orFailure(delegate.fetch(url, formats, options));
    }

    private <T> ScrapeOutcome<T> gated(Supplier<ScrapeOutcome<T>> call) {
        try {
            limiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ScrapeOutcome.failure("interrupted", "interrupted while waiting for a rate limit slot");
        }
        return orFailure(call.get());
    }

    private static <T> ScrapeOutcome<T> orFailure(ScrapeOutcome<T> outcome) {
        return outcome == null ? ScrapeOutcome.failure("unknown_error", "scraping client returned no outcome") : outcome;
    }
}
