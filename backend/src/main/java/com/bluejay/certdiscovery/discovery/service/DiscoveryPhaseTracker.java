package com.bluejay.certdiscovery.discovery.service;

import com.bluejay.certdiscovery.discovery.model.DiscoveryPhase;
import com.bluejay.certdiscovery.discovery.model.PhaseTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Forward-only run state machine. FAILED is reachable from any non-terminal phase.
 */
public class DiscoveryPhaseTracker {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryPhaseTracker.class);

    private final String runId;
    private final Clock clock;
    private final List<PhaseTransition> transitions = new ArrayList<>();
    private DiscoveryPhase current;

    public DiscoveryPhaseTracker(String runId, Clock clock) {
        this.runId = runId;
        this.clock = clock;
        this.current = DiscoveryPhase.STRUCTURE_DISCOVERY;
        transitions.add(new PhaseTransition(null, current, clock.instant(), "run started"));
        log.info("Discovery run {} entered {}", runId, current);
    }

    public synchronized void advance(DiscoveryPhase next, String note) {
        if (next == null || next == DiscoveryPhase.FAILED) {
            throw new InternalInvariantViolationException("use fail() to enter FAILED");
        }
        if (current.isTerminal() || next.ordinal() != current.ordinal() + 1) {
            throw new InternalInvariantViolationException(
                "illegal phase transition " + current + " -> " + next + " in run " + runId);
        }
        record(next, note);
    }

    public synchronized void fail(String note) {
        if (current.isTerminal()) {
            throw new InternalInvariantViolationException(
                "illegal phase transition " + current + " -> FAILED in run " + runId);
        }
        record(DiscoveryPhase.FAILED, note);
    }

    public synchronized DiscoveryPhase current() {
        return current;
    }

    public synchronized List<PhaseTransition> transitions() {
        return List.copyOf(transitions);
    }

    private void record(DiscoveryPhase next, String note) {
        transitions.add(new PhaseTransition(current, next, clock.instant(), note));
        if (next == DiscoveryPhase.FAILED) {
            log.warn("Discovery run {} failed during {}: {}", runId, current, note);
        } else {
            log.info("Discovery run {} {} -> {}{}", runId, current, next, note == null ? "" : " (" + note + ")");
        }
        current = next;
    }
}
