package com.bluejay.certdiscovery.discovery.model;

public record RateLimitStatus(
    int currentRequests,
    int maxRequests,
    int remainingRequests,
    double secondsUntilNextSlot
) {}
