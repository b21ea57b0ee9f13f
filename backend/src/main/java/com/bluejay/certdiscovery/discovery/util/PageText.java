package com.bluejay.certdiscovery.discovery.util;

import com.bluejay.certdiscovery.discovery.model.DiscoveredPage;
import com.bluejay.certdiscovery.discovery.model.PageContent;
import org.jsoup.Jsoup;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class PageText {
    public static final int EXCERPT_LENGTH = 200;

    private PageText() {
    }

    public static String htmlToText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    /**
     * Best available body text in original case: markdown, then HTML text, then raw text.
     */
    public static String bodyText(PageContent content) {
        if (content == null) {
            return "";
        }
        if (content.markdown() != null && !content.markdown().isBlank()) {
            return content.markdown();
        }
        String fromHtml = htmlToText(content.html());
        if (!fromHtml.isBlank()) {
            return fromHtml;
        }
        return content.rawText() == null ? "" : content.rawText();
    }

    /**
     * Everything the categorizer reads about a page, lower-cased and whitespace-collapsed.
     */
    public static String searchableText(DiscoveredPage page) {
        List<String> parts = new ArrayList<>();
        parts.add(page.title());
        parts.add(page.description());
        PageContent content = page.content();
        if (content != null) {
            parts.add(content.markdown());
            parts.add(htmlToText(content.html()));
            parts.add(content.rawText());
            parts.add(content.metadataText("title"));
            parts.add(content.metadataText("description"));
        }
        StringBuilder joined = new StringBuilder();
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                if (joined.length() > 0) {
                    joined.append(' ');
                }
                joined.append(part);
            }
        }
        return collapse(joined.toString()).toLowerCase(Locale.ROOT);
    }

    public static String excerpt(DiscoveredPage page) {
        String text = collapse(bodyText(page.content()));
        if (text.isEmpty()) {
            return "";
        }
        if (text.length() <= EXCERPT_LENGTH) {
            return text;
        }
        return text.substring(0, EXCERPT_LENGTH) + "...";
    }

    public static String collapse(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("\\s+", " ").trim();
    }
}
