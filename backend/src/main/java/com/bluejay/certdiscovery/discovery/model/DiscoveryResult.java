package com.bluejay.certdiscovery.discovery.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record DiscoveryResult(
    String runId,
    CertificationQuery query,
    WebsiteStructure websiteStructure,
    Map<ContentCategory, List<DiscoveredPage>> discoveredContent,
    QualityAssessment qualityAssessment,
    Instant discoveryTimestamp,
    Duration discoveryTime,
    DiscoveryRunStatus status,
    boolean truncated,
    Map<String, Integer> fetchFailures,
    List<String> structureFailures,
    List<String> warnings,
    List<PhaseTransition> phaseTransitions
) {
    public DiscoveryResult {
        Map<ContentCategory, List<DiscoveredPage>> content = new LinkedHashMap<>();
        if (discoveredContent != null) {
            discoveredContent.forEach((category, pages) -> content.put(category, List.copyOf(pages)));
        }
        discoveredContent = Collections.unmodifiableMap(content);
        fetchFailures = fetchFailures == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fetchFailures));
        structureFailures = structureFailures == null ? List.of() : List.copyOf(structureFailures);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        phaseTransitions = phaseTransitions == null ? List.of() : List.copyOf(phaseTransitions);
    }

    public boolean degraded() {
        return websiteStructure != null && websiteStructure.degraded();
    }

    public int fetchFailureCount() {
        return fetchFailures.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int categorizedPageCount() {
        return discoveredContent.values().stream().mapToInt(List::size).sum();
    }

    public List<DiscoveredPage> pagesIn(ContentCategory category) {
        return discoveredContent.getOrDefault(category, List.of());
    }
}
