package com.bluejay.certdiscovery.discovery.service;

public class InternalInvariantViolationException extends DiscoveryException {
    public InternalInvariantViolationException(String message) {
        super(message);
    }
}
