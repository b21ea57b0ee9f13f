package com.bluejay.certdiscovery.discovery.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReasonCodeClassifierTest {

    @Test
    void classifiesScrapingErrorCodes() {
        assertEquals(ReasonCodeClassifier.TIMEOUT, ReasonCodeClassifier.fromErrorCode("crawl_timeout", null));
        assertEquals(ReasonCodeClassifier.HTTP_5XX, ReasonCodeClassifier.fromErrorCode("http_502", "bad gateway"));
        assertEquals(ReasonCodeClassifier.HTTP_402_PAYMENT, ReasonCodeClassifier.fromErrorCode("http_402", null));
        assertEquals(ReasonCodeClassifier.DNS_FAILURE,
            ReasonCodeClassifier.fromErrorCode("io_error", "UnknownHostException: nope.example"));
        assertEquals(ReasonCodeClassifier.MISSING_API_KEY, ReasonCodeClassifier.fromErrorCode("missing_api_key", null));
        assertEquals(ReasonCodeClassifier.EMPTY_CONTENT, ReasonCodeClassifier.fromErrorCode("empty_content", null));
        assertEquals(ReasonCodeClassifier.UNKNOWN, ReasonCodeClassifier.fromErrorCode(null, null));
    }

    @Test
    void onlyTransientReasonsAreRetryable() {
        assertTrue(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.HTTP_429_RATE_LIMIT));
        assertFalse(ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.HTTP_404));
    }
}
