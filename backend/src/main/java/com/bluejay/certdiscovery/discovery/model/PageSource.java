package com.bluejay.certdiscovery.discovery.model;

public enum PageSource {
    MAP,
    CRAWL,
    MAP_AND_CRAWL;

    public PageSource mergedWith(PageSource other) {
        if (other == null || other == this) {
            return this;
        }
        return MAP_AND_CRAWL;
    }
}
