package com.clusterops.orchestrator;

public class UnknownRequestException extends RequestRejectedException {
    public UnknownRequestException(String id) {
        super("Request not found: " + id);
    }
}
