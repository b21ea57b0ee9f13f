package com.bluejay.certdiscovery.discovery.categorize;

import com.bluejay.certdiscovery.discovery.model.CategorizationDiagnostics;
import com.bluejay.certdiscovery.discovery.model.CategoryAssignment;
import com.bluejay.certdiscovery.discovery.model.CertificationQuery;
import com.bluejay.certdiscovery.discovery.model.ContentCategory;
import com.bluejay.certdiscovery.discovery.model.DiscoveredPage;
import com.bluejay.certdiscovery.discovery.util.PageText;
import com.bluejay.certdiscovery.discovery.util.UrlNormalizer;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Multi-signal page classifier. Stateless apart from the query terms and weights it is built with,
 * so one instance can be shared by every page of a run.
 */
public class ContentCategorizer {
    private final CategorizerWeights weights;
    private final CertificationTerms terms;

    public ContentCategorizer(CategorizerWeights weights, CertificationQuery query) {
        this.weights = weights == null ? CategorizerWeights.defaults() : weights;
        this.terms = CertificationTerms.of(query);
    }

    public CategoryAssignment categorize(DiscoveredPage page) {
        return decide(score(page));
    }

    /**
     * Same scoring as {@link #categorize}, with every intermediate signal exposed.
     */
    public CategorizationDiagnostics diagnose(DiscoveredPage page) {
        PageScores scores = score(page);
        CategoryAssignment decision = decide(scores);

        Map<ContentCategory, Integer> raw = new LinkedHashMap<>();
        Map<ContentCategory, Integer> patterns = new LinkedHashMap<>();
        Map<ContentCategory, Integer> keywords = new LinkedHashMap<>();
        for (ContentCategory category : ContentCategory.assignable()) {
            CategoryScore score = scores.byCategory().get(category);
            raw.put(category, score.total());
            patterns.put(category, score.patternHits());
            keywords.put(category, score.keywordHits());
        }
        ContentCategory strongest = strongest(scores);
        CategoryScore best = scores.byCategory().get(strongest);
        double signalStrength = 0.4 * best.patternHits()
            + 0.3 * best.keywordHits()
            + 0.2 * best.urlHits()
            + 0.1 * best.titleHits();
        return new CategorizationDiagnostics(
            page.url(),
            scores.text().length(),
            raw,
            patterns,
            keywords,
            best.urlHits(),
            best.titleHits(),
            scores.relevance(),
            signalStrength,
            decision
        );
    }

    public int certificationRelevance(DiscoveredPage page) {
        return terms.score(PageText.searchableText(page), weights);
    }

    public int maxCertificationRelevance() {
        return terms.maxScore(weights);
    }

    public CategorizerWeights weights() {
        return weights;
    }

    private PageScores score(DiscoveredPage page) {
        String text = PageText.searchableText(page);
        String path = UrlNormalizer.path(page.url()).toLowerCase(Locale.ROOT);
        String title = page.effectiveTitle() == null ? "" : page.effectiveTitle().toLowerCase(Locale.ROOT);
        int relevance = terms.score(text, weights);

        Map<ContentCategory, CategoryScore> byCategory = new EnumMap<>(ContentCategory.class);
        for (ContentCategory category : ContentCategory.assignable()) {
            CategorySignals signals = CategoryVocabulary.signalsFor(category);
            int patternHits = countHits(signals, text);
            int urlHits = countHits(signals, path);
            int titleHits = countHits(signals, title);
            int keywordHits = 0;
            for (String keyword : signals.keywords()) {
                if (text.contains(keyword)) {
                    keywordHits++;
                }
            }
            int indicatorPoints = 0;
            for (ContentTypeIndicator indicator : ContentTypeIndicator.values()) {
                if (indicator.supports(category) && indicator.presentIn(text)) {
                    indicatorPoints += indicator.weight();
                }
            }
            int total = patternHits * weights.pattern()
                + keywordHits * weights.keyword()
                + urlHits * weights.url()
                + titleHits * weights.title()
                + indicatorPoints
                + relevance;
            byCategory.put(category, new CategoryScore(patternHits, keywordHits, urlHits, titleHits, total));
        }
        return new PageScores(text, relevance, byCategory);
    }

    private CategoryAssignment decide(PageScores scores) {
        ContentCategory best = strongest(scores);
        int score = scores.byCategory().get(best).total();
        if (score <= weights.threshold()) {
            return new CategoryAssignment(ContentCategory.UNCATEGORIZED, score, confidence(score));
        }
        return new CategoryAssignment(best, score, confidence(score));
    }

    // Highest total; ties resolved by category priority.
    private ContentCategory strongest(PageScores scores) {
        ContentCategory best = null;
        int bestScore = Integer.MIN_VALUE;
        for (ContentCategory category : ContentCategory.byPriority()) {
            int total = scores.byCategory().get(category).total();
            if (total > bestScore) {
                best = category;
                bestScore = total;
            }
        }
        return best;
    }

    private double confidence(int score) {
        double value = (double) score / weights.saturationCeiling() * 100.0;
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static int countHits(CategorySignals signals, String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int hits = 0;
        for (Pattern pattern : signals.patterns()) {
            if (pattern.matcher(text).find()) {
                hits++;
            }
        }
        return hits;
    }

    private record CategoryScore(int patternHits, int keywordHits, int urlHits, int titleHits, int total) {}

    private record PageScores(String text, int relevance, Map<ContentCategory, CategoryScore> byCategory) {}
}
