package com.bluejay.certdiscovery.discovery.model;

/**
 * Per-run overrides; null fields fall back to the configured defaults.
 */
public record DiscoveryOptions(
    Integer maxPages,
    Integer maxDepth,
    Integer timeoutSeconds,
    Boolean crawlEnabled,
    String searchTerm
) {
    public static DiscoveryOptions defaults() {
        return new DiscoveryOptions(null, null, null, null, null);
    }

    public static DiscoveryOptions mapOnly() {
        return new DiscoveryOptions(null, null, null, false, null);
    }

    public String normalizedSearchTerm() {
        if (searchTerm == null || searchTerm.isBlank()) {
            return null;
        }
        return searchTerm.trim();
    }
}
