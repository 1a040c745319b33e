package com.clusterops.orchestrator;

// another active request already holds the cluster name
public class ConflictException extends RequestRejectedException {
    private final String existingId;

    public ConflictException(String name, String existingId) {
        super("Cluster '" + name + "' is already being created or exists (request " + existingId + ")");
        this.existingId = existingId;
    }

    public String getExistingId() {
        return existingId;
    }
}
