package com.bluejay.certdiscovery.discovery.structure;

import com.bluejay.certdiscovery.config.DiscoveryProperties;
import com.bluejay.certdiscovery.discovery.http.RateLimitedScrapingClient;
import com.bluejay.certdiscovery.discovery.http.ScrapeRateLimiter;
import com.bluejay.certdiscovery.discovery.model.CertificationQuery;
import com.bluejay.certdiscovery.discovery.model.DiscoveredPage;
import com.bluejay.certdiscovery.discovery.model.DiscoveryOptions;
import com.bluejay.certdiscovery.discovery.model.PageContent;
import com.bluejay.certdiscovery.discovery.model.PageSource;
import com.bluejay.certdiscovery.discovery.model.StructureDiscoveryResult;
import com.bluejay.certdiscovery.discovery.scrape.CrawlPage;
import com.bluejay.certdiscovery.discovery.scrape.CrawlRequest;
import com.bluejay.certdiscovery.discovery.scrape.MapLink;
import com.bluejay.certdiscovery.discovery.scrape.ScrapeOutcome;
import com.bluejay.certdiscovery.discovery.scrape.ScrapingClient;
import com.bluejay.certdiscovery.discovery.service.DiscoveryRunContext;
import com.bluejay.certdiscovery.discovery.service.DiscoverySettings;
import com.bluejay.certdiscovery.discovery.service.StructureUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StructureMapperServiceTest {
    private static final String ROOT = "https://example.gov/";
    private static final CertificationQuery QUERY =
        new CertificationQuery("Energy Star Label", "Bureau of Energy Efficiency (BEE)", "India", ROOT);

    @Mock
    private ScrapingClient scrapingClient;

    private ExecutorService executor;
    private StructureMapperService service;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        service = new StructureMapperService(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void mapOnlyRunKeepsMappedPages() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.success(List.of(
            new MapLink("/", "Home", null),
            new MapLink("/license/apply", "Apply for License", null)
        )));

        StructureDiscoveryResult result = service.discover(context(DiscoveryOptions.mapOnly()));

        assertThat(result.pages()).extracting(DiscoveredPage::url)
            .containsExactly("https://example.gov", "https://example.gov/license/apply");
        assertThat(result.pages().get(1).title()).isEqualTo("Apply for License");
        assertThat(result.degraded()).isFalse();
        assertThat(result.domain()).isEqualTo("example.gov");
        verify(scrapingClient, never()).crawl(any());
    }

    @Test
    void crawlFieldsOverrideMappedFieldsForSameUrl() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.success(List.of(
            new MapLink("https://example.gov/a", "A", "mapped a"),
            new MapLink("https://example.gov/fees/", "Old fees", "mapped fees")
        )));
        PageContent feeContent = PageContent.ofMarkdown("Fee schedule 2026", Map.of("title", "Fees"));
        when(scrapingClient.crawl(any())).thenReturn(ScrapeOutcome.success(List.of(
            new CrawlPage("https://example.gov/fees?ref=nav", "Fees", null, feeContent),
            new CrawlPage("https://example.gov/offices", "Offices", "Regional offices", null)
        )));

        StructureDiscoveryResult result = service.discover(context(DiscoveryOptions.defaults()));

        assertThat(result.pages()).extracting(DiscoveredPage::url)
            .containsExactly("https://example.gov/a", "https://example.gov/fees", "https://example.gov/offices");
        DiscoveredPage fees = result.pages().get(1);
        assertThat(fees.title()).isEqualTo("Fees");
        assertThat(fees.description()).isEqualTo("mapped fees");
        assertThat(fees.content()).isEqualTo(feeContent);
        assertThat(fees.source()).isEqualTo(PageSource.MAP_AND_CRAWL);
        assertThat(result.pages().get(2).source()).isEqualTo(PageSource.CRAWL);
        assertThat(result.degraded()).isFalse();
        assertThat(result.mappedCount()).isEqualTo(2);
        assertThat(result.crawledCount()).isEqualTo(2);
    }

    @Test
    void crawlTimeoutDegradesToMapResults() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt()))
            .thenReturn(ScrapeOutcome.success(List.of(MapLink.of("https://example.gov/a"))));
        when(scrapingClient.crawl(any())).thenAnswer(invocation -> {
            Thread.sleep(3000);
            return ScrapeOutcome.success(List.of(new CrawlPage("https://example.gov/late", null, null, null)));
        });

        StructureDiscoveryResult result = service.discover(context(new DiscoveryOptions(null, null, 1, true, null)));

        assertThat(result.degraded()).isTrue();
        assertThat(result.pages()).extracting(DiscoveredPage::url).containsExactly("https://example.gov/a");
        assertThat(result.failures()).containsExactly("crawl:TIMEOUT");
    }

    @Test
    void failedMapWithSuccessfulCrawlIsDegraded() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.failure("http_503", "down"));
        when(scrapingClient.crawl(any())).thenReturn(ScrapeOutcome.success(List.of(
            new CrawlPage("https://example.gov/fees", "Fees", null, null))));

        StructureDiscoveryResult result = service.discover(context(DiscoveryOptions.defaults()));

        assertThat(result.degraded()).isTrue();
        assertThat(result.pages()).hasSize(1);
        assertThat(result.failures()).containsExactly("map:HTTP_5XX");
    }

    @Test
    void bothPhasesFailingIsFatal() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.failure("io_error", "refused"));
        when(scrapingClient.crawl(any())).thenReturn(ScrapeOutcome.failure("crawl_failed", "failed"));

        assertThatThrownBy(() -> service.discover(context(DiscoveryOptions.defaults())))
            .isInstanceOf(StructureUnavailableException.class)
            .satisfies(e -> assertThat(((StructureUnavailableException) e).getFailures())
                .containsExactly("map:UNKNOWN", "crawl:CRAWL_FAILED"));
    }

    @Test
    void searchTermAddsSecondMapPass() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt()))
            .thenReturn(ScrapeOutcome.success(List.of(MapLink.of("https://example.gov/a"))));
        when(scrapingClient.map(eq(ROOT), eq("label fees"), anyInt()))
            .thenReturn(ScrapeOutcome.success(List.of(MapLink.of("https://example.gov/a"), MapLink.of("https://example.gov/fees"))));

        StructureDiscoveryResult result = service.discover(context(new DiscoveryOptions(null, null, null, false, " label fees ")));

        assertThat(result.pages()).extracting(DiscoveredPage::url)
            .containsExactly("https://example.gov/a", "https://example.gov/fees");
    }

    @Test
    void repeatedDiscoveryYieldsSameStructure() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.success(List.of(
            MapLink.of("https://example.gov/b"), MapLink.of("https://example.gov/a"), MapLink.of("https://example.gov/b/"))));
        when(scrapingClient.crawl(any())).thenReturn(ScrapeOutcome.success(List.of(
            new CrawlPage("https://example.gov/c", "C", null, null))));

        StructureDiscoveryResult first = service.discover(context(DiscoveryOptions.defaults()));
        StructureDiscoveryResult second = service.discover(context(DiscoveryOptions.defaults()));

        assertThat(first.pages()).extracting(DiscoveredPage::url)
            .containsExactly("https://example.gov/b", "https://example.gov/a", "https://example.gov/c");
        assertThat(second.pages()).extracting(DiscoveredPage::url)
            .containsExactlyElementsOf(first.pages().stream().map(DiscoveredPage::url).toList());
    }

    @Test
    void crawlRequestCarriesPathFiltersAndLimits() {
        when(scrapingClient.map(eq(ROOT), isNull(), anyInt())).thenReturn(ScrapeOutcome.success(List.of()));
        when(scrapingClient.crawl(any())).thenReturn(ScrapeOutcome.success(List.of()));

        service.discover(context(new DiscoveryOptions(40, 3, null, true, null)));

        ArgumentCaptor<CrawlRequest> captor = ArgumentCaptor.forClass(CrawlRequest.class);
        verify(scrapingClient).crawl(captor.capture());
        CrawlRequest request = captor.getValue();
        assertThat(request.limit()).isEqualTo(40);
        assertThat(request.maxDepth()).isEqualTo(3);
        assertThat(request.includePaths()).contains(
            "*/licen*", "*/licen*/**", "*/fee*", "*/energy*star*label*", "*/energy-star-label*", "*/bee*");
        assertThat(request.excludePaths()).contains("*/news/*", "*/robots*", "*/error*").hasSize(12);
    }

    private DiscoveryRunContext context(DiscoveryOptions options) {
        DiscoveryProperties properties = new DiscoveryProperties();
        properties.setMaxRequestsPerMinute(100);
        DiscoverySettings settings = DiscoverySettings.from(properties, options);
        ScrapeRateLimiter limiter = new ScrapeRateLimiter(100, Duration.ofSeconds(60), Clock.systemUTC());
        return new DiscoveryRunContext("run-1", QUERY, settings,
            new RateLimitedScrapingClient(scrapingClient, limiter), Clock.systemUTC());
    }
}
