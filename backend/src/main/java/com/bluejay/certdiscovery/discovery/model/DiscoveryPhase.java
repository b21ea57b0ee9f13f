package com.bluejay.certdiscovery.discovery.model;

public enum DiscoveryPhase {
    STRUCTURE_DISCOVERY,
    CONTENT_EXTRACTION,
    CATEGORIZATION,
    QUALITY_ASSESSMENT,
    COMPILATION,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
