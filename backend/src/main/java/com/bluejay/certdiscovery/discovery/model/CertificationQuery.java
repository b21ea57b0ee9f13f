package com.bluejay.certdiscovery.discovery.model;

public record CertificationQuery(
    String name,
    String issuingBody,
    String region,
    String officialLink
) {
}
