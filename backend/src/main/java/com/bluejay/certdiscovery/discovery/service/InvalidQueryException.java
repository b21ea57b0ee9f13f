package com.bluejay.certdiscovery.discovery.service;

public class InvalidQueryException extends DiscoveryException {
    public InvalidQueryException(String message) {
        super(message);
    }
}
