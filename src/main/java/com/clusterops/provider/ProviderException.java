package com.clusterops.provider;

/**
 * A provider call did not produce a usable answer. Subclasses separate "the call never got a
 * usable answer" ({@link ProviderTransportException}) from "the provider answered with an error"
 * ({@link ProviderErrorException}).
 */
public abstract class ProviderException extends Exception {
    protected ProviderException(String message) {
        super(message);
    }

    protected ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    // message suitable for the request's status line, verbatim from the provider where possible
    public String getDetail() {
        return getMessage();
    }
}
