package com.bluejay.certdiscovery.discovery.categorize;

import com.bluejay.certdiscovery.discovery.model.ContentCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class CategoryVocabulary {
    private static final Map<ContentCategory, CategorySignals> SIGNALS;

    static {
        Map<ContentCategory, CategorySignals> signals = new EnumMap<>(ContentCategory.class);
        signals.put(ContentCategory.MAIN_CERTIFICATION_PAGES, CategorySignals.of(
            List.of("certif", "licen", "regist", "approv", "accred", "standar", "complian", "regulat", "requir",
                "overview", "introduction", "about", "what.*is", "definition"),
            List.of("certification", "license", "registration", "approval", "accreditation", "standard",
                "compliance", "regulation", "requirement", "overview"),
            List.of("certif", "licen", "regist", "approv", "accred", "standar", "complian", "regulat", "requir")));
        signals.put(ContentCategory.APPLICATION_FORMS, CategorySignals.of(
            List.of("form", "applic", "submi", "regist", "enroll", "download", "fill", "complete", "apply",
                "submit", "enrollment", "registration", "application.*process"),
            List.of("form", "application", "submit", "registration", "enrollment", "download", "fill",
                "complete", "apply", "process"),
            List.of("form", "applic", "submi", "regist", "enroll", "download", "fill", "complete", "apply")));
        signals.put(ContentCategory.TRAINING_MATERIALS, CategorySignals.of(
            List.of("train", "educat", "learn", "course", "workshop", "seminar", "certif", "qualif", "skill",
                "education", "training.*program", "learning.*material", "qualification.*requirement"),
            List.of("training", "education", "learn", "course", "workshop", "seminar", "certification",
                "qualification", "skill", "program"),
            List.of("train", "educat", "learn", "course", "workshop", "seminar", "certif", "qualif", "skill")));
        signals.put(ContentCategory.AUDIT_GUIDELINES, CategorySignals.of(
            List.of("audit", "inspect", "assess", "evaluat", "review", "check", "verif", "validat", "compliance",
                "procedure", "guideline", "checklist", "inspection.*process", "audit.*procedure"),
            List.of("audit", "inspection", "assessment", "evaluation", "review", "check", "verification",
                "validation", "compliance", "procedure"),
            List.of("audit", "inspect", "assess", "evaluat", "review", "check", "verif", "validat", "compliance")));
        signals.put(ContentCategory.FEE_STRUCTURES, CategorySignals.of(
            List.of("fee", "cost", "price", "charg", "payment", "billing", "tariff", "rate", "amount",
                "cost.*structure", "fee.*schedule", "payment.*method", "cost.*breakdown"),
            List.of("fee", "cost", "price", "charge", "payment", "billing", "tariff", "rate", "amount",
                "structure", "schedule"),
            List.of("fee", "cost", "price", "charg", "payment", "billing", "tariff", "rate", "amount")));
        signals.put(ContentCategory.REGIONAL_OFFICES, CategorySignals.of(
            List.of("office", "branch", "locat", "address", "contact", "region", "state", "city", "area",
                "location", "contact.*information", "office.*location", "regional.*office"),
            List.of("office", "branch", "location", "address", "contact", "region", "state", "city", "area",
                "information"),
            List.of("office", "branch", "locat", "address", "contact", "region", "state", "city", "area")));
        SIGNALS = Collections.unmodifiableMap(signals);
    }

    private CategoryVocabulary() {
    }

    public static CategorySignals signalsFor(ContentCategory category) {
        CategorySignals signals = SIGNALS.get(category);
        if (signals == null) {
            throw new IllegalArgumentException("no signals declared for " + category);
        }
        return signals;
    }

    public static Map<ContentCategory, CategorySignals> all() {
        return SIGNALS;
    }
}
