package com.bluejay.certdiscovery.discovery.categorize;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Static signal table for one category.
 *
 * @param patterns  regexes matched against body text, URL path and title
 * @param keywords  literal terms matched as substrings of the body text
 * @param pathStems literal stems used to build crawl include-path globs
 */
public record CategorySignals(List<Pattern> patterns, List<String> keywords, List<String> pathStems) {

    public CategorySignals {
        patterns = List.copyOf(patterns);
        keywords = List.copyOf(keywords);
        pathStems = List.copyOf(pathStems);
    }

    static CategorySignals of(List<String> regexes, List<String> keywords, List<String> pathStems) {
        return new CategorySignals(regexes.stream().map(Pattern::compile).toList(), keywords, pathStems);
    }
}
