package com.bluejay.certdiscovery.discovery.export;

import com.bluejay.certdiscovery.discovery.model.DiscoveryPhase;
import com.bluejay.certdiscovery.discovery.model.DiscoveryRunStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Serialized shape of a discovery result.
 */
@JsonPropertyOrder({
    "certification_name", "issuing_body", "region", "discovery_timestamp",
    "website_structure", "discovered_content", "quality_metrics", "discovery_metadata"
})
public record DiscoveryResultDocument(
    @JsonProperty("certification_name") String certificationName,
    @JsonProperty("issuing_body") String issuingBody,
    @JsonProperty("region") String region,
    @JsonProperty("discovery_timestamp") Instant discoveryTimestamp,
    @JsonProperty("website_structure") Structure websiteStructure,
    @JsonProperty("discovered_content") Map<String, List<ContentItem>> discoveredContent,
    @JsonProperty("quality_metrics") QualityMetrics qualityMetrics,
    @JsonProperty("discovery_metadata") Metadata discoveryMetadata
) {
    public record Structure(
        @JsonProperty("official_url") String officialUrl,
        @JsonProperty("domain") String domain,
        @JsonProperty("total_pages") int totalPages,
        @JsonProperty("degraded") boolean degraded,
        @JsonProperty("page_categories") Map<String, List<String>> pageCategories
    ) {}

    public record ContentItem(
        @JsonProperty("url") String url,
        @JsonProperty("title") String title,
        @JsonProperty("category") String category,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("content_excerpt") String contentExcerpt
    ) {}

    public record QualityMetrics(
        @JsonProperty("overall_score") double overallScore,
        @JsonProperty("score_breakdown") ScoreBreakdown scoreBreakdown,
        @JsonProperty("insights") Insights insights,
        @JsonProperty("recommendations") List<String> recommendations
    ) {}

    public record ScoreBreakdown(
        @JsonProperty("relevance") double relevance,
        @JsonProperty("completeness") double completeness,
        @JsonProperty("freshness") double freshness,
        @JsonProperty("accessibility") double accessibility
    ) {}

    public record Insights(
        @JsonProperty("strengths") List<String> strengths,
        @JsonProperty("weaknesses") List<String> weaknesses,
        @JsonProperty("opportunities") List<String> opportunities,
        @JsonProperty("threats") List<String> threats
    ) {}

    public record Metadata(
        @JsonProperty("run_id") String runId,
        @JsonProperty("status") DiscoveryRunStatus status,
        @JsonProperty("truncated") boolean truncated,
        @JsonProperty("degraded") boolean degraded,
        @JsonProperty("discovery_time_seconds") double discoveryTimeSeconds,
        @JsonProperty("fetch_failure_count") int fetchFailureCount,
        @JsonProperty("fetch_failures") Map<String, Integer> fetchFailures,
        @JsonProperty("structure_failures") List<String> structureFailures,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("phase_transitions") List<Transition> phaseTransitions
    ) {}

    public record Transition(
        @JsonProperty("from") DiscoveryPhase from,
        @JsonProperty("to") DiscoveryPhase to,
        @JsonProperty("at") Instant at,
        @JsonProperty("note") String note
    ) {}
}
