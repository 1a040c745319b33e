package com.clusterops.orchestrator;

// bad cluster name or tier; no record was created
public class ValidationException extends RequestRejectedException {
    public ValidationException(String message) {
        super(message);
    }
}
