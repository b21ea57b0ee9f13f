package com.bluejay.certdiscovery.discovery.categorize;

import com.bluejay.certdiscovery.config.DiscoveryProperties;

public record CategorizerWeights(
    int pattern,
    int keyword,
    int url,
    int title,
    int name,
    int acronym,
    int bodyKeyword,
    int region,
    int threshold,
    int saturationCeiling
) {
    public static CategorizerWeights defaults() {
        return new CategorizerWeights(3, 5, 8, 6, 5, 3, 1, 2, 10, 80);
    }

    public static CategorizerWeights from(DiscoveryProperties.Categorizer properties) {
        if (properties == null) {
            return defaults();
        }
        return new CategorizerWeights(
            properties.getPatternWeight(),
            properties.getKeywordWeight(),
            properties.getUrlWeight(),
            properties.getTitleWeight(),
            properties.getNameWeight(),
            properties.getAcronymWeight(),
            properties.getBodyKeywordWeight(),
            properties.getRegionWeight(),
            properties.getThreshold(),
            properties.getSaturationCeiling()
        );
    }
}
