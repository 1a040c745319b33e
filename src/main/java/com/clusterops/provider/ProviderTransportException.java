package com.clusterops.provider;

/**
 * Connection failure, per-call timeout or a throttling/gateway response. Says nothing about the
 * cluster itself, so pollers retry on the next tick.
 */
public class ProviderTransportException extends ProviderException {
    public ProviderTransportException(String message) {
        super(message);
    }

    public ProviderTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
