package com.bluejay.certdiscovery.discovery.model;

import java.util.Map;

public record PageContent(
    String markdown,
    String html,
    String rawText,
    Map<String, Object> metadata
) {
    public PageContent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static PageContent ofMarkdown(String markdown, Map<String, Object> metadata) {
        return new PageContent(markdown, null, null, metadata);
    }

    public boolean hasBody() {
        return isPresent(markdown) || isPresent(html) || isPresent(rawText);
    }

    public boolean hasMetadata() {
        return !metadata.isEmpty();
    }

    public String metadataText(String key) {
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
