package com.clusterops.orchestrator;

/**
 * A consumer call was refused before anything was changed. The message is meant for the caller.
 */
public abstract class RequestRejectedException extends Exception {
    protected RequestRejectedException(String message) {
        super(message);
    }
}
