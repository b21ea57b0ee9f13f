package com.bluejay.certdiscovery.discovery.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public record WebsiteStructure(
    String officialUrl,
    String domain,
    int totalPages,
    List<DiscoveredPage> pageList,
    Map<ContentCategory, Set<String>> pagesByCategory,
    boolean degraded
) {
    public WebsiteStructure {
        pageList = pageList == null ? List.of() : List.copyOf(pageList);
        Map<ContentCategory, Set<String>> copy = new LinkedHashMap<>();
        if (pagesByCategory != null) {
            for (Map.Entry<ContentCategory, Set<String>> entry : pagesByCategory.entrySet()) {
                copy.put(entry.getKey(), Collections.unmodifiableSet(new LinkedHashSet<>(entry.getValue())));
            }
        }
        pagesByCategory = Collections.unmodifiableMap(copy);
    }

    public static WebsiteStructure of(
        String officialUrl,
        String domain,
        List<DiscoveredPage> pageList,
        Map<ContentCategory, Set<String>> pagesByCategory,
        boolean degraded
    ) {
        int total = pageList == null ? 0 : pageList.size();
        return new WebsiteStructure(officialUrl, domain, total, pageList, pagesByCategory, degraded);
    }

    /**
     * Lists every broken structural invariant; empty when the structure is consistent.
     */
    public List<String> invariantViolations() {
        List<String> violations = new ArrayList<>();
        if (totalPages != pageList.size()) {
            violations.add("total_pages=" + totalPages + " but page_list has " + pageList.size() + " entries");
        }
        Set<String> known = new HashSet<>();
        for (DiscoveredPage page : pageList) {
            if (!known.add(page.url())) {
                violations.add("duplicate page_list url " + page.url());
            }
        }
        for (Map.Entry<ContentCategory, Set<String>> entry : pagesByCategory.entrySet()) {
            for (String url : entry.getValue()) {
                if (!known.contains(url)) {
                    violations.add(entry.getKey().wireName() + " references unknown url " + url);
                }
            }
        }
        return violations;
    }
}
