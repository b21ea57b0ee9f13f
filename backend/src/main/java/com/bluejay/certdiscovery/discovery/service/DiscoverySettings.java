package com.bluejay.certdiscovery.discovery.service;

import com.bluejay.certdiscovery.config.DiscoveryProperties;
import com.bluejay.certdiscovery.discovery.categorize.CategorizerWeights;
import com.bluejay.certdiscovery.discovery.model.DiscoveryOptions;
import com.bluejay.certdiscovery.discovery.quality.QualitySettings;

import java.time.Duration;

/**
 * Configuration snapshot taken once at the start of a run, with per-run options applied.
 */
public record DiscoverySettings(
    int maxRequestsPerMinute,
    Duration rateLimitWindow,
    int maxConcurrentJobs,
    int maxPages,
    int maxDepth,
    Duration crawlTimeout,
    Duration runTimeout,
    boolean crawlEnabled,
    String searchTerm,
    CategorizerWeights categorizerWeights,
    QualitySettings qualitySettings
) {
    public static DiscoverySettings from(DiscoveryProperties properties, DiscoveryOptions options) {
        DiscoveryOptions safeOptions = options == null ? DiscoveryOptions.defaults() : options;
        int maxPages = safeOptions.maxPages() == null ? properties.getMaxPages() : Math.max(1, safeOptions.maxPages());
        int maxDepth = safeOptions.maxDepth() == null ? properties.getMaxDepth() : Math.max(1, safeOptions.maxDepth());
        int crawlTimeoutSeconds = safeOptions.timeoutSeconds() == null
            ? properties.getTimeoutSeconds()
            : Math.max(1, safeOptions.timeoutSeconds());
        boolean crawlEnabled = safeOptions.crawlEnabled() == null || safeOptions.crawlEnabled();
        return new DiscoverySettings(
            properties.getMaxRequestsPerMinute(),
            Duration.ofSeconds(properties.getRateLimitWindowSeconds()),
            properties.getMaxConcurrentJobs(),
            maxPages,
            maxDepth,
            Duration.ofSeconds(crawlTimeoutSeconds),
            Duration.ofSeconds(properties.getRunTimeoutSeconds()),
            crawlEnabled,
            safeOptions.normalizedSearchTerm(),
            CategorizerWeights.from(properties.getCategorizer()),
            QualitySettings.from(properties.getQuality())
        );
    }

    public boolean hasRunTimeout() {
        return runTimeout != null && !runTimeout.isZero() && !runTimeout.isNegative();
    }
}
