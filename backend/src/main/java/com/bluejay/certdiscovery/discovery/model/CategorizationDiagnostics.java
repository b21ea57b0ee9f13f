package com.bluejay.certdiscovery.discovery.model;

import java.util.Map;

public record CategorizationDiagnostics(
    String url,
    int textLength,
    Map<ContentCategory, Integer> rawScores,
    Map<ContentCategory, Integer> patternMatches,
    Map<ContentCategory, Integer> keywordMatches,
    int urlSignals,
    int titleSignals,
    int relevanceBonus,
    double signalStrength,
    CategoryAssignment decision
) {
    public CategorizationDiagnostics {
        rawScores = rawScores == null ? Map.of() : java.util.Collections.unmodifiableMap(new java.util.LinkedHashMap<>(rawScores));
        patternMatches = patternMatches == null ? Map.of() : java.util.Collections.unmodifiableMap(new java.util.LinkedHashMap<>(patternMatches));
        keywordMatches = keywordMatches == null ? Map.of() : java.util.Collections.unmodifiableMap(new java.util.LinkedHashMap<>(keywordMatches));
    }
}
