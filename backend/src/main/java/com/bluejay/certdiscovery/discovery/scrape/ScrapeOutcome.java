package com.bluejay.certdiscovery.discovery.scrape;

import java.util.Objects;

/**
 * Result of one call into the scraping capability. Exactly one of {@code value} or {@code errorCode} is set.
 */
public record ScrapeOutcome<T>(T value, String errorCode, String errorMessage) {

    public ScrapeOutcome {
        if ((value == null) == (errorCode == null)) {
            throw new IllegalArgumentException("exactly one of value or errorCode must be set");
        }
    }

    public static <T> ScrapeOutcome<T> success(T value) {
        return new ScrapeOutcome<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> ScrapeOutcome<T> failure(String errorCode, String errorMessage) {
        String code = errorCode == null || errorCode.isBlank() ? "unknown_error" : errorCode;
        return new ScrapeOutcome<>(null, code, errorMessage);
    }

    public boolean isSuccessful() {
        return errorCode == null;
    }

    public <U> ScrapeOutcome<U> mapFailure() {
        if (isSuccessful()) {
            throw new IllegalStateException("outcome is successful");
        }
        return new ScrapeOutcome<>(null, errorCode, errorMessage);
    }
}
