package com.bluejay.certdiscovery.discovery.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

public enum ContentCategory {
    MAIN_CERTIFICATION_PAGES("main_certification_pages", 0, "Core certification information and requirements"),
    APPLICATION_FORMS("application_forms", 1, "Forms, applications, and submission procedures"),
    TRAINING_MATERIALS("training_materials", 3, "Training courses, qualifications, and educational content"),
    AUDIT_GUIDELINES("audit_guidelines", 2, "Audit procedures, inspection guidelines, and compliance checks"),
    FEE_STRUCTURES("fee_structures", 4, "Cost information, fee schedules, and payment details"),
    REGIONAL_OFFICES("regional_offices", 5, "Office locations, contact information, and regional details"),
    UNCATEGORIZED("uncategorized", Integer.MAX_VALUE, "Content without a confident category");

    private final String wireName;
    private final int priority;
    private final String description;

    ContentCategory(String wireName, int priority, String description) {
        this.wireName = wireName;
        this.priority = priority;
        this.description = description;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Tie-break rank; lower wins.
     */
    public int priority() {
        return priority;
    }

    public String description() {
        return description;
    }

    public boolean isAssignable() {
        return this != UNCATEGORIZED;
    }

    /**
     * The six real categories in declaration order.
     */
    public static List<ContentCategory> assignable() {
        return Arrays.stream(values()).filter(ContentCategory::isAssignable).toList();
    }

    /**
     * The six real categories in tie-break order.
     */
    public static List<ContentCategory> byPriority() {
        return assignable().stream().sorted(Comparator.comparingInt(ContentCategory::priority)).toList();
    }
}
