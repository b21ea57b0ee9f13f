package com.bluejay.certdiscovery.discovery.model;

public record CategoryAssignment(ContentCategory category, int score, double confidence) {}
