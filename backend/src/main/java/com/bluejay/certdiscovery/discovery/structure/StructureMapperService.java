package com.bluejay.certdiscovery.discovery.structure;

import com.bluejay.certdiscovery.discovery.categorize.CategoryVocabulary;
import com.bluejay.certdiscovery.discovery.categorize.CertificationTerms;
import com.bluejay.certdiscovery.discovery.model.CertificationQuery;
import com.bluejay.certdiscovery.discovery.model.DiscoveredPage;
import com.bluejay.certdiscovery.discovery.model.PageContent;
import com.bluejay.certdiscovery.discovery.model.PageSource;
import com.bluejay.certdiscovery.discovery.model.StructureDiscoveryResult;
import com.bluejay.certdiscovery.discovery.scrape.CrawlPage;
import com.bluejay.certdiscovery.discovery.scrape.CrawlRequest;
import com.bluejay.certdiscovery.discovery.scrape.MapLink;
import com.bluejay.certdiscovery.discovery.scrape.ScrapeOutcome;
import com.bluejay.certdiscovery.discovery.service.DiscoveryRunContext;
import com.bluejay.certdiscovery.discovery.service.DiscoverySettings;
import com.bluejay.certdiscovery.discovery.service.StructureUnavailableException;
import com.bluejay.certdiscovery.discovery.util.ReasonCodeClassifier;
import com.bluejay.certdiscovery.discovery.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds the page list of a site from a broad map call and a path-filtered crawl.
 */
@Service
public class StructureMapperService {
    private static final Logger log = LoggerFactory.getLogger(StructureMapperService.class);

    static final List<String> EXCLUDE_PATHS = List.of(
        "*/news/*", "*/press/*", "*/events/*", "*/blog/*",
        "*/about/*", "*/contact/*", "*/privacy/*", "*/terms/*",
        "*/sitemap*", "*/robots*", "*/404*", "*/error*"
    );
    static final List<String> CRAWL_FORMATS = List.of("markdown");

    private final ExecutorService structureCallExecutor;

    public StructureMapperService(@Qualifier("structureCallExecutor") ExecutorService structureCallExecutor) {
        this.structureCallExecutor = structureCallExecutor;
    }

    public StructureDiscoveryResult discover(DiscoveryRunContext context) {
        DiscoverySettings settings = context.settings();
        String root = context.query().officialLink().trim();
        String domain = UrlNormalizer.host(root);
        Map<String, DiscoveredPage> merged = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();

        ScrapeOutcome<List<MapLink>> mapped = context.client().map(root, null, settings.maxPages());
        boolean mapSucceeded = mapped.isSuccessful();
        int mappedCount = 0;
        if (mapSucceeded) {
            mappedCount += mergeLinks(mapped.value(), root, merged);
        } else {
            failures.add("map:" + reason(mapped));
            log.warn("Map of {} failed: {} {}", root, mapped.errorCode(), mapped.errorMessage());
        }

        if (settings.searchTerm() != null) {
            ScrapeOutcome<List<MapLink>> searched = context.client().map(root, settings.searchTerm(), settings.maxPages());
            if (searched.isSuccessful()) {
                mappedCount += mergeLinks(searched.value(), root, merged);
            } else {
                failures.add("map_search:" + reason(searched));
                log.warn("Search map of {} for '{}' failed: {}", root, settings.searchTerm(), searched.errorCode());
            }
        }

        boolean crawlSucceeded = false;
        int crawledCount = 0;
        if (settings.crawlEnabled()) {
            ScrapeOutcome<List<CrawlPage>> crawled = crawlWithTimeout(context, crawlRequest(root, context.query(), settings,
                crawlBudget(context)));
            crawlSucceeded = crawled.isSuccessful();
            if (crawlSucceeded) {
                crawledCount = mergeCrawl(crawled.value(), root, merged, context);
            } else {
                failures.add("crawl:" + reason(crawled));
                log.warn("Crawl of {} failed: {} {}", root, crawled.errorCode(), crawled.errorMessage());
            }
        }

        if (!mapSucceeded && !crawlSucceeded) {
            throw new StructureUnavailableException("no structure could be discovered for " + root, failures);
        }
        boolean degraded = settings.crawlEnabled() && (!mapSucceeded || !crawlSucceeded);
        log.info(
            "Structure of {}: pages={} mapped={} crawled={} degraded={}",
            root,
            merged.size(),
            mappedCount,
            crawledCount,
            degraded
        );
        return new StructureDiscoveryResult(root, domain, new ArrayList<>(merged.values()), mappedCount, crawledCount,
            degraded, failures);
    }

    static CrawlRequest crawlRequest(String root, CertificationQuery query, DiscoverySettings settings, Duration timeout) {
        return new CrawlRequest(
            root,
            settings.maxPages(),
            settings.maxDepth(),
            includePaths(query),
            EXCLUDE_PATHS,
            CRAWL_FORMATS,
            timeout
        );
    }

    static List<String> includePaths(CertificationQuery query) {
        Set<String> paths = new LinkedHashSet<>();
        CategoryVocabulary.all().values().forEach(signals -> {
            for (String stem : signals.pathStems()) {
                paths.add("*/" + stem + "*");
                paths.add("*/" + stem + "*/**");
            }
        });
        String name = query.name() == null ? "" : query.name().trim().toLowerCase(Locale.ROOT);
        if (!name.isEmpty()) {
            paths.add("*/" + name.replaceAll("\\s+", "*") + "*");
            paths.add("*/" + name.replaceAll("\\s+", "-") + "*");
        }
        for (String acronym : CertificationTerms.of(query).acronyms()) {
            paths.add("*/" + acronym.toLowerCase(Locale.ROOT) + "*");
        }
        return List.copyOf(paths);
    }

    private ScrapeOutcome<List<CrawlPage>> crawlWithTimeout(DiscoveryRunContext context, CrawlRequest request) {
        Future<ScrapeOutcome<List<CrawlPage>>> future = structureCallExecutor.submit(() -> context.client().crawl(request));
        try {
            ScrapeOutcome<List<CrawlPage>> outcome = future.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            return outcome == null ? ScrapeOutcome.failure("crawl_failed", "no crawl outcome") : outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            return ScrapeOutcome.failure("crawl_timeout", "crawl exceeded " + request.timeout().toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return ScrapeOutcome.failure("crawl_failed", cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ScrapeOutcome.failure("interrupted", "interrupted while waiting for crawl");
        }
    }

    // The crawl never outlives the run deadline.
    private Duration crawlBudget(DiscoveryRunContext context) {
        Duration budget = context.settings().crawlTimeout();
        Duration remaining = context.remaining();
        if (remaining != null && remaining.compareTo(budget) < 0) {
            budget = remaining.isZero() ? Duration.ofMillis(1) : remaining;
        }
        return budget;
    }

    private int mergeLinks(List<MapLink> links, String root, Map<String, DiscoveredPage> merged) {
        int accepted = 0;
        for (MapLink link : links) {
            String url = UrlNormalizer.normalize(link.url(), root);
            if (url == null) {
                continue;
            }
            accepted++;
            DiscoveredPage existing = merged.get(url);
            if (existing == null) {
                merged.put(url, DiscoveredPage.shallow(url, blankToNull(link.title()), blankToNull(link.description()),
                    PageSource.MAP));
            } else {
                merged.put(url, DiscoveredPage.shallow(
                    url,
                    firstPresent(existing.title(), link.title()),
                    firstPresent(existing.description(), link.description()),
                    existing.source()
                ));
            }
        }
        return accepted;
    }

    private int mergeCrawl(List<CrawlPage> pages, String root, Map<String, DiscoveredPage> merged, DiscoveryRunContext context) {
        int accepted = 0;
        for (CrawlPage page : pages) {
            String url = UrlNormalizer.normalize(page.url(), root);
            if (url == null) {
                continue;
            }
            accepted++;
            DiscoveredPage existing = merged.get(url);
            PageContent content = page.content() != null && (page.content().hasBody() || page.content().hasMetadata())
                ? page.content()
                : null;
            if (existing == null) {
                DiscoveredPage fresh = DiscoveredPage.shallow(url, blankToNull(page.title()),
                    blankToNull(page.description()), PageSource.CRAWL);
                merged.put(url, content == null ? fresh : fresh.withContent(content, context.clock().instant()));
                continue;
            }
            DiscoveredPage combined = new DiscoveredPage(
                url,
                firstPresent(page.title(), existing.title()),
                firstPresent(page.description(), existing.description()),
                content == null ? existing.content() : content,
                content == null ? existing.fetchedAt() : context.clock().instant(),
                null,
                null,
                existing.source().mergedWith(PageSource.CRAWL)
            );
            merged.put(url, combined);
        }
        return accepted;
    }

    private static String reason(ScrapeOutcome<?> outcome) {
        return ReasonCodeClassifier.fromErrorCode(outcome.errorCode(), outcome.errorMessage());
    }

    private static String firstPresent(String preferred, String fallback) {
        String value = blankToNull(preferred);
        return value != null ? value : blankToNull(fallback);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
