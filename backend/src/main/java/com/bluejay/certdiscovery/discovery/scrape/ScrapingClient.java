package com.bluejay.certdiscovery.discovery.scrape;

import com.bluejay.certdiscovery.discovery.model.PageContent;

import java.util.List;

/**
 * Outbound scraping capability. Implementations report failures through {@link ScrapeOutcome} and never return null.
 */
public interface ScrapingClient {

    ScrapeOutcome<List<MapLink>> map(String url, String search, int limit);

    ScrapeOutcome<List<CrawlPage>> crawl(CrawlRequest request);

    ScrapeOutcome<PageContent> fetch(String url, List<String> formats, FetchOptions options);
}
