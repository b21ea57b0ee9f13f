package com.bluejay.certdiscovery.discovery.http;

import java.time.Duration;

/**
 * Lets the owner of a call stop it while it waits for a rate limit slot.
 */
public interface CallGuard {

    boolean stopped();

    /**
     * Longest time the call may wait for a slot, or null for no bound.
     */
    Duration waitBudget();
}
