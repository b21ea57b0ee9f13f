package com.bluejay.certdiscovery.discovery.export;

import com.bluejay.certdiscovery.discovery.model.ContentCategory;
import com.bluejay.certdiscovery.discovery.model.DiscoveredPage;
import com.bluejay.certdiscovery.discovery.model.DiscoveryResult;
import com.bluejay.certdiscovery.discovery.model.QualityAssessment;
import com.bluejay.certdiscovery.discovery.model.QualityInsights;
import com.bluejay.certdiscovery.discovery.model.WebsiteStructure;
import com.bluejay.certdiscovery.discovery.util.PageText;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class DiscoveryResultExporter {
    private final ObjectMapper objectMapper;

    public DiscoveryResultExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DiscoveryResultDocument toDocument(DiscoveryResult result) {
        WebsiteStructure structure = result.websiteStructure();
        Map<String, List<String>> pageCategories = new LinkedHashMap<>();
        for (Map.Entry<ContentCategory, Set<String>> entry : structure.pagesByCategory().entrySet()) {
            pageCategories.put(entry.getKey().wireName(), new ArrayList<>(entry.getValue()));
        }

        Map<String, List<DiscoveryResultDocument.ContentItem>> content = new LinkedHashMap<>();
        for (Map.Entry<ContentCategory, List<DiscoveredPage>> entry : result.discoveredContent().entrySet()) {
            List<DiscoveryResultDocument.ContentItem> items = new ArrayList<>();
            for (DiscoveredPage page : entry.getValue()) {
                items.add(new DiscoveryResultDocument.ContentItem(
                    page.url(),
                    page.effectiveTitle(),
                    entry.getKey().wireName(),
                    page.confidence(),
                    PageText.excerpt(page)
                ));
            }
            content.put(entry.getKey().wireName(), items);
        }

        QualityAssessment quality = result.qualityAssessment();
        QualityInsights insights = quality.insights();
        DiscoveryResultDocument.QualityMetrics metrics = new DiscoveryResultDocument.QualityMetrics(
            quality.overall(),
            new DiscoveryResultDocument.ScoreBreakdown(
                quality.relevance(),
                quality.completeness(),
                quality.freshness(),
                quality.accessibility()
            ),
            new DiscoveryResultDocument.Insights(
                insights.strengths(),
                insights.weaknesses(),
                insights.opportunities(),
                insights.threats()
            ),
            quality.recommendations()
        );

        DiscoveryResultDocument.Metadata metadata = new DiscoveryResultDocument.Metadata(
            result.runId(),
            result.status(),
            result.truncated(),
            result.degraded(),
            result.discoveryTime() == null ? 0.0 : result.discoveryTime().toMillis() / 1000.0,
            result.fetchFailureCount(),
            result.fetchFailures(),
            result.structureFailures(),
            result.warnings(),
            result.phaseTransitions().stream()
                .map(t -> new DiscoveryResultDocument.Transition(t.from(), t.to(), t.at(), t.note()))
                .toList()
        );

        return new DiscoveryResultDocument(
            result.query().name(),
            result.query().issuingBody(),
            result.query().region(),
            result.discoveryTimestamp(),
            new DiscoveryResultDocument.Structure(
                structure.officialUrl(),
                structure.domain(),
                structure.totalPages(),
                structure.degraded(),
                pageCategories
            ),
            content,
            metrics,
            metadata
        );
    }

    public String toJson(DiscoveryResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize discovery result " + result.runId(), e);
        }
    }
}
