package com.clusterops.provider;

/**
 * Provider-neutral classification of a cluster status. Each provider maps its own status
 * strings onto these values.
 */
public enum ObservedState {
    PROVISIONING,
    READY,
    FAILED,
    DELETING,
    OTHER
}
