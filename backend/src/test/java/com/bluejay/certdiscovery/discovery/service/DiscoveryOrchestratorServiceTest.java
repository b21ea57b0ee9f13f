package com.bluejay.certdiscovery.discovery.service;

import com.bluejay.certdiscovery.config.DiscoveryProperties;
import com.bluejay.certdiscovery.discovery.model.CertificationQuery;
import com.bluejay.certdiscovery.discovery.model.ContentCategory;
import com.bluejay.certdiscovery.discovery.model.DiscoveredPage;
import com.bluejay.certdiscovery.discovery.model.DiscoveryOptions;
import com.bluejay.certdiscovery.discovery.model.DiscoveryPhase;
import com.bluejay.certdiscovery.discovery.model.DiscoveryResult;
import com.bluejay.certdiscovery.discovery.model.DiscoveryRunStatus;
import com.bluejay.certdiscovery.discovery.model.DiscoverySummary;
import com.bluejay.certdiscovery.discovery.model.PageContent;
import com.bluejay.certdiscovery.discovery.model.PhaseTransition;
import com.bluejay.certdiscovery.discovery.scrape.FetchOptions;
import com.bluejay.certdiscovery.discovery.scrape.MapLink;
import com.bluejay.certdiscovery.discovery.scrape.ScrapeOutcome;
import com.bluejay.certdiscovery.discovery.scrape.ScrapingClient;
import com.bluejay.certdiscovery.discovery.structure.StructureMapperService;
import com.bluejay.certdiscovery.discovery.util.ReasonCodeClassifier;
import com.bluejay.certdiscovery.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryOrchestratorServiceTest {
    private static final String ROOT = "https://example.gov";
    private static final CertificationQuery QUERY =
        new CertificationQuery("Zeta Mark", "Omega Board", "Nowhere", ROOT);

    @Mock
    private ScrapingClient scrapingClient;

    private ExecutorService structureExecutor;
    private ExecutorService runExecutor;
    private DiscoveryProperties properties;

    @BeforeEach
    void setUp() {
        structureExecutor = Executors.newCachedThreadPool();
        runExecutor = Executors.newSingleThreadExecutor();
        properties = new DiscoveryProperties();
        properties.setMaxRequestsPerMinute(1000);
        properties.setMaxConcurrentJobs(1);
    }

    @AfterEach
    void tearDown() {
        structureExecutor.shutdownNow();
        runExecutor.shutdownNow();
    }

    @Test
    void invalidQueryFailsBeforeAnyOutboundCall() {
        DiscoveryOrchestratorService service = service(Clock.systemUTC());

        assertThatThrownBy(() -> service.run(new CertificationQuery(" ", "Body", "Region", ROOT), DiscoveryOptions.defaults()))
            .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> service.run(new CertificationQuery("Name", "Body", "Region", "ftp://example.gov"),
            DiscoveryOptions.defaults()))
            .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> service.run(null, DiscoveryOptions.defaults()))
            .isInstanceOf(InvalidQueryException.class);
        verifyNoInteractions(scrapingClient);
    }

    @Test
    void mapOnlyRunCategorizesFetchedPages() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.success(List.of(
            new MapLink("/", "Home", null),
            new MapLink("/license/apply", "Apply for License", null)
        )));
        when(scrapingClient.fetch(eq("https://example.gov"), anyList(), any(FetchOptions.class)))
            .thenReturn(ScrapeOutcome.success(PageContent.ofMarkdown("Welcome", Map.of("title", "Home"))));
        when(scrapingClient.fetch(eq("https://example.gov/license/apply"), anyList(), any(FetchOptions.class)))
            .thenReturn(ScrapeOutcome.success(PageContent.ofMarkdown(
                "Submit the application form and fill in every field to apply.", Map.of("title", "Apply for License"))));

        DiscoveryResult result = service(Clock.systemUTC()).run(QUERY, DiscoveryOptions.mapOnly());

        assertThat(result.websiteStructure().totalPages()).isEqualTo(2);
        assertThat(result.websiteStructure().invariantViolations()).isEmpty();
        assertThat(result.pagesIn(ContentCategory.APPLICATION_FORMS)).extracting(DiscoveredPage::url)
            .containsExactly("https://example.gov/license/apply");
        assertThat(result.pagesIn(ContentCategory.UNCATEGORIZED)).extracting(DiscoveredPage::url)
            .containsExactly("https://example.gov");
        assertThat(result.status()).isEqualTo(DiscoveryRunStatus.COMPLETED);
        assertThat(result.degraded()).isFalse();
        assertThat(result.truncated()).isFalse();
        assertThat(result.phaseTransitions()).extracting(PhaseTransition::to).last().isEqualTo(DiscoveryPhase.DONE);
        assertThat(result.websiteStructure().pagesByCategory().get(ContentCategory.APPLICATION_FORMS))
            .containsExactly("https://example.gov/license/apply");
    }

    @Test
    void zeroSuccessfulFetchesStillCompiles() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.success(List.of(
            MapLink.of("/fees"), MapLink.of("/offices"), MapLink.of("/training"))));
        when(scrapingClient.fetch(anyString(), anyList(), any(FetchOptions.class)))
            .thenReturn(ScrapeOutcome.failure("http_500", "boom"));

        DiscoveryResult result = service(Clock.systemUTC()).run(QUERY, DiscoveryOptions.mapOnly());

        assertThat(result.discoveredContent().values()).allMatch(List::isEmpty);
        assertThat(result.qualityAssessment().completeness()).isZero();
        assertThat(result.fetchFailures()).containsEntry(ReasonCodeClassifier.HTTP_5XX, 3);
        assertThat(result.fetchFailureCount()).isEqualTo(3);
        assertThat(result.websiteStructure().totalPages()).isEqualTo(3);
        assertThat(result.warnings()).anyMatch(warning -> warning.startsWith("content extraction failed"));
        assertThat(result.status()).isEqualTo(DiscoveryRunStatus.COMPLETED_WITH_ERRORS);
    }

    @Test
    void deadlineMidExtractionKeepsFetchedPagesAndTruncates() {
        MutableClock clock = new MutableClock(Instant.parse("2026-05-01T08:00:00Z"));
        properties.setRunTimeoutSeconds(100);
        List<MapLink> links = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            links.add(MapLink.of("/page-" + i));
        }
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.success(links));
        AtomicInteger fetches = new AtomicInteger();
        when(scrapingClient.fetch(anyString(), anyList(), any(FetchOptions.class))).thenAnswer(invocation -> {
            if (fetches.incrementAndGet() == 5) {
                clock.advance(Duration.ofSeconds(200));
            }
            return ScrapeOutcome.success(PageContent.ofMarkdown("Fee schedule and payment details", null));
        });

        DiscoveryResult result = service(clock).run(QUERY, DiscoveryOptions.mapOnly());

        assertThat(result.truncated()).isTrue();
        assertThat(result.status()).isEqualTo(DiscoveryRunStatus.TRUNCATED);
        assertThat(result.categorizedPageCount()).isEqualTo(5);
        assertThat(result.websiteStructure().totalPages()).isEqualTo(10);
        assertThat(result.websiteStructure().pageList().stream().filter(DiscoveredPage::isCategorized).map(DiscoveredPage::url))
            .containsExactly("https://example.gov/page-1", "https://example.gov/page-2", "https://example.gov/page-3",
                "https://example.gov/page-4", "https://example.gov/page-5");
        assertThat(result.qualityAssessment().insights().threats()).anyMatch(threat -> threat.contains("deadline"));
        verify(scrapingClient, times(5)).fetch(anyString(), anyList(), any(FetchOptions.class));
    }

    @Test
    void deadlineStopsWorkersWaitingForRateLimitSlot() {
        properties.setMaxRequestsPerMinute(1);
        properties.setRateLimitWindowSeconds(2);
        properties.setMaxConcurrentJobs(3);
        properties.setRunTimeoutSeconds(1);
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.success(List.of(
            MapLink.of("/fees"), MapLink.of("/offices"), MapLink.of("/training"))));

        DiscoveryResult result = service(Clock.systemUTC()).run(QUERY, DiscoveryOptions.mapOnly());

        assertThat(result.truncated()).isTrue();
        assertThat(result.status()).isEqualTo(DiscoveryRunStatus.TRUNCATED);
        assertThat(result.categorizedPageCount()).isZero();
        assertThat(result.discoveryTime()).isLessThan(Duration.ofSeconds(2));
        assertThat(result.warnings()).contains("3 pages skipped after the run deadline");
        verify(scrapingClient, never()).fetch(anyString(), anyList(), any(FetchOptions.class));
    }

    @Test
    void unreachableStructureFailsTheRun() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.failure("timeout", "slow"));
        when(scrapingClient.crawl(any())).thenReturn(ScrapeOutcome.failure("http_502", "bad gateway"));

        assertThatThrownBy(() -> service(Clock.systemUTC()).run(QUERY, DiscoveryOptions.defaults()))
            .isInstanceOf(StructureUnavailableException.class);
    }

    @Test
    void startAsyncRunsOnRunExecutorAndSummarizes() throws Exception {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt()))
            .thenReturn(ScrapeOutcome.success(List.of(new MapLink("/fees", "Fee schedule", "Tariff and payment"))));
        when(scrapingClient.fetch(anyString(), anyList(), any(FetchOptions.class)))
            .thenReturn(ScrapeOutcome.success(PageContent.ofMarkdown("Fee schedule, tariff and payment methods", null)));
        DiscoveryOrchestratorService service = service(Clock.systemUTC());

        DiscoveryResult result = service.startAsync(QUERY, DiscoveryOptions.mapOnly()).get(10, TimeUnit.SECONDS);
        DiscoverySummary summary = service.summarize(result);

        assertThat(summary.totalPagesDiscovered()).isEqualTo(1);
        assertThat(summary.relevantPagesFound()).isEqualTo(1);
        assertThat(summary.contentCategoriesFound()).isEqualTo(1);
        assertThat(summary.contentSummary()).containsEntry(ContentCategory.FEE_STRUCTURES, 1);
        assertThat(summary.qualityScore()).isEqualTo(result.qualityAssessment().overall());
    }

    private DiscoveryOrchestratorService service(Clock clock) {
        return new DiscoveryOrchestratorService(
            properties,
            scrapingClient,
            new StructureMapperService(structureExecutor),
            runExecutor,
            clock
        );
    }
}
