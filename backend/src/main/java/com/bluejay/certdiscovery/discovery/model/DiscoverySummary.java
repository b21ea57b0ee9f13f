package com.bluejay.certdiscovery.discovery.model;

import java.time.Instant;
import java.util.Map;

public record DiscoverySummary(
    String certificationName,
    String issuingBody,
    String region,
    int totalPagesDiscovered,
    int relevantPagesFound,
    int contentCategoriesFound,
    Map<ContentCategory, Integer> contentSummary,
    double qualityScore,
    double discoveryTimeSeconds,
    DiscoveryRunStatus status,
    Instant discoveryTimestamp
) {}
