package com.bluejay.certdiscovery.discovery.service;

import java.util.List;

/**
 * Neither the map nor the crawl call produced any structure for the site.
 */
public class StructureUnavailableException extends DiscoveryException {
    private final List<String> failures;

    public StructureUnavailableException(String message, List<String> failures) {
        super(message);
        this.failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public List<String> getFailures() {
        return failures;
    }
}
