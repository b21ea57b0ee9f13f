package com.bluejay.certdiscovery.discovery.model;

import java.time.Instant;

public record PhaseTransition(DiscoveryPhase from, DiscoveryPhase to, Instant at, String note) {}
