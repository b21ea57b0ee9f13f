package com.bluejay.certdiscovery.discovery.categorize;

import com.bluejay.certdiscovery.discovery.model.ContentCategory;

import java.util.List;
import java.util.Set;

public enum ContentTypeIndicator {
    FORM(4, List.of("form", "application", "submit", "fill", "complete"),
        Set.of(ContentCategory.APPLICATION_FORMS)),
    PDF_DOCUMENT(3, List.of(".pdf", "pdf", "document", "download"),
        Set.of(ContentCategory.APPLICATION_FORMS, ContentCategory.AUDIT_GUIDELINES, ContentCategory.FEE_STRUCTURES)),
    GUIDELINE(3, List.of("guideline", "procedure", "manual", "instruction"),
        Set.of(ContentCategory.AUDIT_GUIDELINES, ContentCategory.TRAINING_MATERIALS)),
    SCHEDULE(3, List.of("schedule", "tariff", "price list"),
        Set.of(ContentCategory.FEE_STRUCTURES)),
    CONTACT(2, List.of("contact", "address", "phone", "email", "location"),
        Set.of(ContentCategory.REGIONAL_OFFICES)),
    OVERVIEW(2, List.of("overview", "introduction", "about", "what is", "definition"),
        Set.of(ContentCategory.MAIN_CERTIFICATION_PAGES));

    private final int weight;
    private final List<String> terms;
    private final Set<ContentCategory> supports;

    ContentTypeIndicator(int weight, List<String> terms, Set<ContentCategory> supports) {
        this.weight = weight;
        this.terms = terms;
        this.supports = supports;
    }

    public int weight() {
        return weight;
    }

    public boolean supports(ContentCategory category) {
        return supports.contains(category);
    }

    /**
     * True when any term occurs in the already lower-cased text.
     */
    public boolean presentIn(String text) {
        for (String term : terms) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }
}
