package com.clusterops.orchestrator;

// one Quartz job per (kind, request id); SWEEP uses a fixed id
public enum TimerKind {
    PROGRESS,
    RECONCILE,
    DELETION,
    SWEEP;

    public String group() {
        return name().toLowerCase();
    }
}
