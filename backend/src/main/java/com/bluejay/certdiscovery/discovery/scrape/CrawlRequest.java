package com.bluejay.certdiscovery.discovery.scrape;

import java.time.Duration;
import java.util.List;

public record CrawlRequest(
    String url,
    int limit,
    int maxDepth,
    List<String> includePaths,
    List<String> excludePaths,
    List<String> formats,
    Duration timeout
) {
    public CrawlRequest {
        includePaths = includePaths == null ? List.of() : List.copyOf(includePaths);
        excludePaths = excludePaths == null ? List.of() : List.copyOf(excludePaths);
        formats = formats == null ? List.of() : List.copyOf(formats);
    }
}
