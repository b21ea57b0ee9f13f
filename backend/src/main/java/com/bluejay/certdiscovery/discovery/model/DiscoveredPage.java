package com.bluejay.certdiscovery.discovery.model;

import java.time.Instant;

public record DiscoveredPage(
    String url,
    String title,
    String description,
    PageContent content,
    Instant fetchedAt,
    ContentCategory category,
    Double confidence,
    PageSource source
) {
    public static DiscoveredPage shallow(String url, String title, String description, PageSource source) {
        return new DiscoveredPage(url, title, description, null, null, null, null, source);
    }

    public DiscoveredPage withContent(PageContent fetched, Instant at) {
        return new DiscoveredPage(url, title, description, fetched, at, category, confidence, source);
    }

    public DiscoveredPage withCategory(ContentCategory assigned, double assignedConfidence) {
        return new DiscoveredPage(url, title, description, content, fetchedAt, assigned, assignedConfidence, source);
    }

    public boolean isCategorized() {
        return category != null;
    }

    public boolean hasContent() {
        return content != null && content.hasBody();
    }

    /**
     * Page title, falling back to the fetched metadata title.
     */
    public String effectiveTitle() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        return content == null ? null : content.metadataText("title");
    }

    public String effectiveDescription() {
        if (description != null && !description.isBlank()) {
            return description;
        }
        return content == null ? null : content.metadataText("description");
    }
}
