package com.bluejay.certdiscovery.discovery.model;

import java.util.List;

public record QualityAssessment(
    double relevance,
    double completeness,
    double freshness,
    double accessibility,
    double overall,
    QualityInsights insights,
    List<String> recommendations
) {
    public static final double RELEVANCE_WEIGHT = 0.35;
    public static final double COMPLETENESS_WEIGHT = 0.30;
    public static final double FRESHNESS_WEIGHT = 0.20;
    public static final double ACCESSIBILITY_WEIGHT = 0.15;

    public QualityAssessment {
        insights = insights == null ? QualityInsights.empty() : insights;
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public static QualityAssessment zero() {
        return new QualityAssessment(0.0, 0.0, 0.0, 0.0, 0.0, QualityInsights.empty(), List.of());
    }

    public static double weightedOverall(double relevance, double completeness, double freshness, double accessibility) {
        double overall = relevance * RELEVANCE_WEIGHT
            + completeness * COMPLETENESS_WEIGHT
            + freshness * FRESHNESS_WEIGHT
            + accessibility * ACCESSIBILITY_WEIGHT;
        return Math.max(0.0, Math.min(100.0, overall));
    }
}
