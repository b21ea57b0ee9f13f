package com.bluejay.certdiscovery.discovery.quality;

import com.bluejay.certdiscovery.config.DiscoveryProperties;

public record QualitySettings(int minBodyLength, int structuralBonus) {

    public static QualitySettings defaults() {
        return new QualitySettings(200, 10);
    }

    public static QualitySettings from(DiscoveryProperties.Quality properties) {
        if (properties == null) {
            return defaults();
        }
        return new QualitySettings(properties.getMinBodyLength(), properties.getStructuralBonus());
    }
}
