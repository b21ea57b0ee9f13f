package com.bluejay.certdiscovery.discovery.model;

public enum DiscoveryRunStatus {
    COMPLETED,
    COMPLETED_WITH_ERRORS,
    TRUNCATED
}
