package com.bluejay.certdiscovery.discovery.quality;

import com.bluejay.certdiscovery.discovery.categorize.ContentCategorizer;
import com.bluejay.certdiscovery.discovery.model.ContentCategory;
import com.bluejay.certdiscovery.discovery.model.DiscoveredPage;
import com.bluejay.certdiscovery.discovery.model.QualityAssessment;
import com.bluejay.certdiscovery.discovery.model.QualityInsights;
import com.bluejay.certdiscovery.discovery.util.PageText;
import com.bluejay.certdiscovery.discovery.util.UrlNormalizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class QualityScorer {
    private static final double NEUTRAL_FRESHNESS = 0.5;
    private static final double METADATA_FRESHNESS_BONUS = 0.2;
    private static final Set<String> LAST_MODIFIED_KEYS = Set.of("lastModified", "last_modified", "modifiedTime",
        "article:modified_time", "dateModified");
    private static final Set<String> UPDATED_KEYS = Set.of("updatedAt", "updated_at", "updated");

    private final QualitySettings settings;
    private final Clock clock;

    public QualityScorer(QualitySettings settings, Clock clock) {
        this.settings = settings == null ? QualitySettings.defaults() : settings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public QualityAssessment assess(
        Map<ContentCategory, List<DiscoveredPage>> categorized,
        ContentCategorizer categorizer,
        boolean degraded,
        boolean truncated
    ) {
        List<DiscoveredPage> pages = new ArrayList<>();
        categorized.values().forEach(pages::addAll);

        double relevance = round2(relevance(categorized, categorizer));
        double completeness = round2(completeness(categorized));
        double freshness = round2(freshness(pages));
        double accessibility = round2(accessibility(pages, degraded));
        double overall = round2(QualityAssessment.weightedOverall(relevance, completeness, freshness, accessibility));

        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();
        List<String> opportunities = new ArrayList<>();
        List<String> threats = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();

        judge("relevance", relevance, strengths, weaknesses, recommendations,
            "Review and refine content categorization for better relevance");
        judge("completeness", completeness, strengths, weaknesses, recommendations,
            "Increase crawling depth to discover missing content categories");
        judge("freshness", freshness, strengths, weaknesses, recommendations,
            "Implement regular content freshness monitoring");
        judge("accessibility", accessibility, strengths, weaknesses, recommendations,
            "Check for website access restrictions or technical issues");

        for (ContentCategory category : ContentCategory.assignable()) {
            if (categorized.getOrDefault(category, List.of()).isEmpty()) {
                opportunities.add("No " + category.wireName() + " content found: " + category.description());
            }
        }
        if (degraded) {
            threats.add("Website structure is degraded: part of the mapping failed or timed out");
        }
        if (truncated) {
            threats.add("Discovery run hit its deadline before all pages were extracted");
        }
        if (pages.stream().noneMatch(DiscoveredPage::hasContent)) {
            threats.add("No relevant content discovered - may indicate website changes or access issues");
        }

        if (overall < 50) {
            recommendations.add("Consider re-running discovery with different parameters");
            recommendations.add("Verify website accessibility and availability");
            recommendations.add("Check for website structure changes");
        } else if (overall < 75) {
            recommendations.add("Expand crawling depth for better coverage");
            recommendations.add("Add more specific search terms for content discovery");
            recommendations.add("Consider manual review of discovered content");
        } else {
            recommendations.add("Discovery quality is good - consider moving to content extraction phase");
            recommendations.add("Monitor for content updates and changes");
        }

        return new QualityAssessment(
            relevance,
            completeness,
            freshness,
            accessibility,
            overall,
            new QualityInsights(strengths, weaknesses, opportunities, threats),
            recommendations
        );
    }

    double relevance(Map<ContentCategory, List<DiscoveredPage>> categorized, ContentCategorizer categorizer) {
        int max = categorizer.maxCertificationRelevance();
        if (max <= 0) {
            return 0.0;
        }
        double bucketSum = 0.0;
        int buckets = 0;
        for (List<DiscoveredPage> bucket : categorized.values()) {
            if (bucket.isEmpty()) {
                continue;
            }
            double pageSum = 0.0;
            for (DiscoveredPage page : bucket) {
                pageSum += Math.min(100.0, categorizer.certificationRelevance(page) * 100.0 / max);
            }
            bucketSum += pageSum / bucket.size();
            buckets++;
        }
        return buckets == 0 ? 0.0 : bucketSum / buckets;
    }

    double completeness(Map<ContentCategory, List<DiscoveredPage>> categorized) {
        List<ContentCategory> categories = ContentCategory.assignable();
        double perCategory = 100.0 / categories.size();
        double score = 0.0;
        for (ContentCategory category : categories) {
            List<DiscoveredPage> bucket = categorized.getOrDefault(category, List.of());
            if (bucket.stream().anyMatch(this::hasQualityIndicator)) {
                score += perCategory;
            }
        }
        return Math.min(100.0, score);
    }

    double freshness(List<DiscoveredPage> pages) {
        if (pages.isEmpty()) {
            return 0.0;
        }
        Instant now = clock.instant();
        double sum = 0.0;
        for (DiscoveredPage page : pages) {
            double score = page.fetchedAt() == null ? NEUTRAL_FRESHNESS : ageScore(Duration.between(page.fetchedAt(), now));
            if (page.content() != null) {
                if (hasAny(page, LAST_MODIFIED_KEYS)) {
                    score += METADATA_FRESHNESS_BONUS;
                }
                if (hasAny(page, UPDATED_KEYS)) {
                    score += METADATA_FRESHNESS_BONUS;
                }
            }
            sum += Math.min(1.0, score);
        }
        return sum / pages.size() * 100.0;
    }

    double accessibility(List<DiscoveredPage> pages, boolean degraded) {
        if (pages.isEmpty()) {
            return 0.0;
        }
        int https = 0;
        int withContent = 0;
        int completeMetadata = 0;
        for (DiscoveredPage page : pages) {
            if (UrlNormalizer.isHttps(page.url())) {
                https++;
            }
            if (page.hasContent()) {
                withContent++;
            }
            if (notBlank(page.effectiveTitle()) && notBlank(page.effectiveDescription())) {
                completeMetadata++;
            }
        }
        double total = pages.size();
        double score = 35.0 * https / total + 35.0 * withContent / total + 20.0 * completeMetadata / total;
        if (!degraded) {
            score += settings.structuralBonus();
        }
        return Math.min(100.0, score);
    }

    private boolean hasQualityIndicator(DiscoveredPage page) {
        if (page.content() == null) {
            return false;
        }
        if (page.content().hasMetadata()) {
            return true;
        }
        return PageText.bodyText(page.content()).trim().length() >= settings.minBodyLength();
    }

    private static double ageScore(Duration age) {
        long hours = Math.max(0, age.toHours());
        if (hours <= 24) {
            return 1.0;
        }
        if (hours <= 7 * 24) {
            return 0.9;
        }
        if (hours <= 30 * 24) {
            return 0.8;
        }
        if (hours <= 90 * 24) {
            return 0.7;
        }
        if (hours <= 365 * 24) {
            return 0.6;
        }
        return 0.5;
    }

    private static boolean hasAny(DiscoveredPage page, Set<String> keys) {
        for (String key : keys) {
            if (page.content().metadataText(key) != null) {
                return true;
            }
        }
        return false;
    }

    private static void judge(
        String name,
        double score,
        List<String> strengths,
        List<String> weaknesses,
        List<String> recommendations,
        String remedy
    ) {
        if (score < 50) {
            weaknesses.add("Low " + name + " score (" + score + ")");
            recommendations.add(remedy);
        } else if (score > 85) {
            strengths.add("Strong " + name + " score (" + score + ")");
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
