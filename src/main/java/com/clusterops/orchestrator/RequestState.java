package com.clusterops.orchestrator;

/**
 * Lifecycle of a provisioning request. A cancelled request is a {@link #DELETING} record with
 * its cancelled flag set; there is no separate cancelled state.
 */
public enum RequestState {
    INITIALIZING(false),
    CREATING(false),
    READY(true),
    FAILED(true),
    DELETING(false),
    DELETED(true);

    private final boolean terminal;

    RequestState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    // states in which the reconciliation poller is expected to run
    public boolean isProvisioning() {
        return this == INITIALIZING || this == CREATING;
    }
}
