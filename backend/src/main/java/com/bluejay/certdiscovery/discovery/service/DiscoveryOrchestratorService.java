package com.bluejay.certdiscovery.discovery.service;

import com.bluejay.certdiscovery.config.DiscoveryProperties;
import com.bluejay.certdiscovery.discovery.categorize.ContentCategorizer;
import com.bluejay.certdiscovery.discovery.http.RateLimitedScrapingClient;
import com.bluejay.certdiscovery.discovery.http.ScrapeRateLimiter;
import com.bluejay.certdiscovery.discovery.model.CategoryAssignment;
import com.bluejay.certdiscovery.discovery.model.CertificationQuery;
import com.bluejay.certdiscovery.discovery.model.ContentCategory;
import com.bluejay.certdiscovery.discovery.model.DiscoveredPage;
import com.bluejay.certdiscovery.discovery.model.DiscoveryOptions;
import com.bluejay.certdiscovery.discovery.model.DiscoveryPhase;
import com.bluejay.certdiscovery.discovery.model.DiscoveryResult;
import com.bluejay.certdiscovery.discovery.model.DiscoveryRunStatus;
import com.bluejay.certdiscovery.discovery.model.DiscoverySummary;
import com.bluejay.certdiscovery.discovery.model.PageContent;
import com.bluejay.certdiscovery.discovery.model.QualityAssessment;
import com.bluejay.certdiscovery.discovery.model.StructureDiscoveryResult;
import com.bluejay.certdiscovery.discovery.model.WebsiteStructure;
import com.bluejay.certdiscovery.discovery.quality.QualityScorer;
import com.bluejay.certdiscovery.discovery.scrape.FetchOptions;
import com.bluejay.certdiscovery.discovery.scrape.ScrapeOutcome;
import com.bluejay.certdiscovery.discovery.scrape.ScrapingClient;
import com.bluejay.certdiscovery.discovery.structure.StructureMapperService;
import com.bluejay.certdiscovery.discovery.util.ReasonCodeClassifier;
import com.bluejay.certdiscovery.discovery.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class DiscoveryOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryOrchestratorService.class);
    private static final List<String> FETCH_FORMATS = List.of("markdown", "html");
    private static final FetchOptions FETCH_OPTIONS = new FetchOptions(true, true, 30_000);

    private final DiscoveryProperties properties;
    private final ScrapingClient scrapingClient;
    private final StructureMapperService structureMapperService;
    private final ExecutorService discoveryRunExecutor;
    private final Clock clock;

    public DiscoveryOrchestratorService(
        DiscoveryProperties properties,
        ScrapingClient scrapingClient,
        StructureMapperService structureMapperService,
        @Qualifier("discoveryRunExecutor") ExecutorService discoveryRunExecutor,
        Clock clock
    ) {
        this.properties = properties;
        this.scrapingClient = scrapingClient;
        this.structureMapperService = structureMapperService;
        this.discoveryRunExecutor = discoveryRunExecutor;
        this.clock = clock;
    }

    public DiscoveryResult run(CertificationQuery query, DiscoveryOptions options) {
        validate(query);
        DiscoverySettings settings = DiscoverySettings.from(properties, options);
        String runId = UUID.randomUUID().toString();
        ScrapeRateLimiter limiter = new ScrapeRateLimiter(settings.maxRequestsPerMinute(), settings.rateLimitWindow(), clock);
        DiscoveryRunContext context = new DiscoveryRunContext(
            runId,
            query,
            settings,
            new RateLimitedScrapingClient(scrapingClient, limiter),
            clock
        );
        log.info("Discovery run {} started for '{}' at {}", runId, query.name(), query.officialLink());
        DiscoveryPhaseTracker tracker = new DiscoveryPhaseTracker(runId, clock);
        try {
            DiscoveryResult result = execute(context, tracker);
            log.info(
                "Discovery run {} finished: status={} pages={} categorized={} overall={} rate_limit={}",
                runId,
                result.status(),
                result.websiteStructure().totalPages(),
                result.categorizedPageCount(),
                result.qualityAssessment().overall(),
                limiter.status()
            );
            return result;
        } catch (DiscoveryException e) {
            if (!tracker.current().isTerminal()) {
                tracker.fail(e.getMessage());
            }
            throw e;
        }
    }

    public CompletableFuture<DiscoveryResult> startAsync(CertificationQuery query, DiscoveryOptions options) {
        validate(query);
        return CompletableFuture.supplyAsync(() -> run(query, options), discoveryRunExecutor);
    }

    public DiscoverySummary summarize(DiscoveryResult result) {
        Map<ContentCategory, Integer> counts = new LinkedHashMap<>();
        int relevant = 0;
        int categoriesFound = 0;
        for (ContentCategory category : ContentCategory.assignable()) {
            int size = result.pagesIn(category).size();
            counts.put(category, size);
            relevant += size;
            if (size > 0) {
                categoriesFound++;
            }
        }
        return new DiscoverySummary(
            result.query().name(),
            result.query().issuingBody(),
            result.query().region(),
            result.websiteStructure().totalPages(),
            relevant,
            categoriesFound,
            counts,
            result.qualityAssessment().overall(),
            result.discoveryTime().toMillis() / 1000.0,
            result.status(),
            result.discoveryTimestamp()
        );
    }

    private DiscoveryResult execute(DiscoveryRunContext context, DiscoveryPhaseTracker tracker) {
        DiscoverySettings settings = context.settings();
        List<String> warnings = new ArrayList<>();

        StructureDiscoveryResult structure = structureMapperService.discover(context);

        boolean truncated = false;
        Map<String, DiscoveredPage> fetched = new ConcurrentHashMap<>();
        Map<String, Integer> fetchFailures = new ConcurrentHashMap<>();
        if (context.deadlinePassed()) {
            truncated = true;
            tracker.advance(DiscoveryPhase.CONTENT_EXTRACTION, "skipped: run deadline passed");
        } else {
            tracker.advance(DiscoveryPhase.CONTENT_EXTRACTION, structure.pages().size() + " pages");
            int skipped = extract(context, structure.pages(), fetched, fetchFailures);
            if (skipped > 0) {
                warnings.add(skipped + " pages skipped after the run deadline");
            }
            truncated = skipped > 0 || context.isCancelled() || context.deadlinePassed();
        }
        if (!structure.pages().isEmpty() && fetched.isEmpty()) {
            warnings.add("content extraction failed: no page was fetched successfully");
            log.warn("Discovery run {} fetched no page content out of {} pages", context.runId(), structure.pages().size());
        }

        tracker.advance(DiscoveryPhase.CATEGORIZATION, fetched.size() + " pages");
        ContentCategorizer categorizer = new ContentCategorizer(settings.categorizerWeights(), context.query());
        Map<ContentCategory, List<DiscoveredPage>> discoveredContent = new LinkedHashMap<>();
        for (ContentCategory category : ContentCategory.values()) {
            discoveredContent.put(category, new ArrayList<>());
        }
        List<DiscoveredPage> pageList = new ArrayList<>();
        for (DiscoveredPage page : structure.pages()) {
            DiscoveredPage withContent = fetched.get(page.url());
            if (withContent == null) {
                pageList.add(page);
                continue;
            }
            DiscoveredPage categorized = categorize(categorizer, withContent);
            discoveredContent.get(categorized.category()).add(categorized);
            pageList.add(categorized);
        }

        tracker.advance(DiscoveryPhase.QUALITY_ASSESSMENT, null);
        QualityAssessment assessment;
        try {
            assessment = new QualityScorer(settings.qualitySettings(), clock)
                .assess(discoveredContent, categorizer, structure.degraded(), truncated);
        } catch (RuntimeException e) {
            log.warn("Quality assessment failed for run {}", context.runId(), e);
            warnings.add("quality assessment failed: " + e.getMessage());
            assessment = QualityAssessment.zero();
        }

        tracker.advance(DiscoveryPhase.COMPILATION, null);
        Map<ContentCategory, Set<String>> pagesByCategory = new LinkedHashMap<>();
        discoveredContent.forEach((category, pages) -> {
            if (!pages.isEmpty()) {
                Set<String> urls = new LinkedHashSet<>();
                pages.forEach(page -> urls.add(page.url()));
                pagesByCategory.put(category, urls);
            }
        });
        WebsiteStructure websiteStructure = WebsiteStructure.of(
            structure.officialUrl(),
            structure.domain(),
            pageList,
            pagesByCategory,
            structure.degraded()
        );
        List<String> violations = websiteStructure.invariantViolations();
        if (!violations.isEmpty()) {
            throw new InternalInvariantViolationException("inconsistent website structure: " + String.join("; ", violations));
        }

        DiscoveryRunStatus status;
        if (truncated) {
            status = DiscoveryRunStatus.TRUNCATED;
        } else if (structure.degraded() || !fetchFailures.isEmpty() || !warnings.isEmpty()) {
            status = DiscoveryRunStatus.COMPLETED_WITH_ERRORS;
        } else {
            status = DiscoveryRunStatus.COMPLETED;
        }
        tracker.advance(DiscoveryPhase.DONE, status.name());
        Instant finishedAt = clock.instant();
        return new DiscoveryResult(
            context.runId(),
            context.query(),
            websiteStructure,
            discoveredContent,
            assessment,
            finishedAt,
            Duration.between(context.startedAt(), finishedAt),
            status,
            truncated,
            new LinkedHashMap<>(fetchFailures),
            structure.failures(),
            warnings,
            tracker.transitions()
        );
    }

    /**
     * Fetches every page on a per-run pool. Returns the number of pages skipped because the run
     * deadline passed.
     */
    private int extract(
        DiscoveryRunContext context,
        List<DiscoveredPage> pages,
        Map<String, DiscoveredPage> fetched,
        Map<String, Integer> failures
    ) {
        if (pages.isEmpty()) {
            return 0;
        }
        AtomicInteger skipped = new AtomicInteger();
        ExecutorService workers = Executors.newFixedThreadPool(context.settings().maxConcurrentJobs());
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        try {
            for (DiscoveredPage page : pages) {
                futures.add(CompletableFuture.runAsync(() -> fetchOne(context, page, fetched, failures, skipped), workers));
            }
            for (CompletableFuture<Void> future : futures) {
                Duration remaining = context.remaining();
                try {
                    if (remaining == null) {
                        future.get();
                    } else if (remaining.isZero()) {
                        context.cancel();
                        break;
                    } else {
                        future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
                    }
                } catch (TimeoutException e) {
                    context.cancel();
                    break;
                } catch (ExecutionException e) {
                    log.warn("Extraction task failed in run {}", context.runId(), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    context.cancel();
                    break;
                }
            }
            if (context.isCancelled()) {
                log.info("Run {} deadline reached during extraction; waiting for in-flight fetches", context.runId());
                // In-flight fetches finish and are kept; queued or slot-waiting ones see the cancel flag and return.
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .exceptionally(ignored -> null)
                    .join();
            }
        } finally {
            workers.shutdown();
        }
        return skipped.get();
    }

    private void fetchOne(
        DiscoveryRunContext context,
        DiscoveredPage page,
        Map<String, DiscoveredPage> fetched,
        Map<String, Integer> failures,
        AtomicInteger skipped
    ) {
        try {
            ScrapeOutcome<PageContent> outcome = context.client().fetch(page.url(), FETCH_FORMATS, FETCH_OPTIONS, context);
            if (outcome.isSuccessful()) {
                fetched.put(page.url(), page.withContent(outcome.value(), context.clock().instant()));
                return;
            }
            if (RateLimitedScrapingClient.STOPPED.equals(outcome.errorCode())) {
                skipped.incrementAndGet();
                return;
            }
            String reason = ReasonCodeClassifier.fromErrorCode(outcome.errorCode(), outcome.errorMessage());
            failures.merge(reason, 1, Integer::sum);
            log.warn("Fetch of {} failed in run {}: {} ({})", page.url(), context.runId(), reason, outcome.errorMessage());
        } catch (RuntimeException e) {
            failures.merge(ReasonCodeClassifier.UNKNOWN, 1, Integer::sum);
            log.warn("Fetch of {} threw in run {}", page.url(), context.runId(), e);
        }
    }

    private DiscoveredPage categorize(ContentCategorizer categorizer, DiscoveredPage page) {
        try {
            CategoryAssignment assignment = categorizer.categorize(page);
            return page.withCategory(assignment.category(), assignment.confidence());
        } catch (RuntimeException e) {
            log.warn("Categorization of {} failed; marking uncategorized", page.url(), e);
            return page.withCategory(ContentCategory.UNCATEGORIZED, 0.0);
        }
    }

    static void validate(CertificationQuery query) {
        if (query == null) {
            throw new InvalidQueryException("certification query is required");
        }
        requireText(query.name(), "name");
        requireText(query.issuingBody(), "issuing body");
        requireText(query.region(), "region");
        requireText(query.officialLink(), "official link");
        if (!UrlNormalizer.isHttpUrl(query.officialLink().trim())) {
            throw new InvalidQueryException("official link must be an absolute http(s) URL: " + query.officialLink());
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidQueryException("certification " + field + " must not be blank");
        }
    }
}
