package com.bluejay.certdiscovery.discovery.categorize;

import com.bluejay.certdiscovery.discovery.model.CertificationQuery;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Query-derived terms used for relevance scoring and crawl path filters.
 */
public record CertificationTerms(String name, List<String> acronyms, List<String> issuerKeywords, String region) {
    private static final Pattern ACRONYM = Pattern.compile("\\b[A-Z]{2,}\\b");
    private static final Pattern WORD = Pattern.compile("\\b[a-z]{4,}\\b");
    private static final Set<String> STOPWORDS = Set.of("authority", "administration", "department", "ministry");

    public CertificationTerms {
        acronyms = List.copyOf(acronyms);
        issuerKeywords = List.copyOf(issuerKeywords);
    }

    public static CertificationTerms of(CertificationQuery query) {
        String name = lowerOrNull(query.name());
        String region = lowerOrNull(query.region());
        Set<String> acronyms = new LinkedHashSet<>();
        Set<String> keywords = new LinkedHashSet<>();
        String issuer = query.issuingBody() == null ? "" : query.issuingBody();
        Matcher acronymMatcher = ACRONYM.matcher(issuer);
        while (acronymMatcher.find()) {
            acronyms.add(acronymMatcher.group());
        }
        Matcher wordMatcher = WORD.matcher(issuer.toLowerCase(Locale.ROOT));
        while (wordMatcher.find()) {
            String word = wordMatcher.group();
            if (!STOPWORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return new CertificationTerms(name, List.copyOf(acronyms), List.copyOf(keywords), region);
    }

    /**
     * Relevance points for lower-cased {@code text}.
     */
    public int score(String text, CategorizerWeights weights) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int score = 0;
        if (name != null && text.contains(name)) {
            score += weights.name();
        }
        for (String acronym : acronyms) {
            if (text.contains(acronym.toLowerCase(Locale.ROOT))) {
                score += weights.acronym();
            }
        }
        for (String keyword : issuerKeywords) {
            if (text.contains(keyword)) {
                score += weights.bodyKeyword();
            }
        }
        if (region != null && text.contains(region)) {
            score += weights.region();
        }
        return score;
    }

    public int maxScore(CategorizerWeights weights) {
        int max = 0;
        if (name != null) {
            max += weights.name();
        }
        max += acronyms.size() * weights.acronym();
        max += issuerKeywords.size() * weights.bodyKeyword();
        if (region != null) {
            max += weights.region();
        }
        return max;
    }

    private static String lowerOrNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
