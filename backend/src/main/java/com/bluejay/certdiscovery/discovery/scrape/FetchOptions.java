package com.bluejay.certdiscovery.discovery.scrape;

public record FetchOptions(boolean onlyMainContent, boolean parsePdf, int timeoutMs) {

    public static FetchOptions defaults() {
        return new FetchOptions(true, true, 30_000);
    }
}
