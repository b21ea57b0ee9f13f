package com.bluejay.certdiscovery.discovery.model;

import java.util.List;

public record StructureDiscoveryResult(
    String officialUrl,
    String domain,
    List<DiscoveredPage> pages,
    int mappedCount,
    int crawledCount,
    boolean degraded,
    List<String> failures
) {
    public StructureDiscoveryResult {
        pages = pages == null ? List.of() : List.copyOf(pages);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
