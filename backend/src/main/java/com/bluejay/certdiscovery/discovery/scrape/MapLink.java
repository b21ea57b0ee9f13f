package com.bluejay.certdiscovery.discovery.scrape;

public record MapLink(String url, String title, String description) {

    public static MapLink of(String url) {
        return new MapLink(url, null, null);
    }
}
