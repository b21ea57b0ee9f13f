package com.bluejay.certdiscovery.discovery.scrape;

import com.bluejay.certdiscovery.discovery.model.PageContent;

public record CrawlPage(String url, String title, String description, PageContent content) {}
