package com.bluejay.certdiscovery.discovery.model;

import java.util.List;

public record QualityInsights(
    List<String> strengths,
    List<String> weaknesses,
    List<String> opportunities,
    List<String> threats
) {
    public QualityInsights {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        opportunities = opportunities == null ? List.of() : List.copyOf(opportunities);
        threats = threats == null ? List.of() : List.copyOf(threats);
    }

    public static QualityInsights empty() {
        return new QualityInsights(List.of(), List.of(), List.of(), List.of());
    }
}
