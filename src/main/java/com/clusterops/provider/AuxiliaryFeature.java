package com.clusterops.provider;

/* Manage a one-off add-on that is switched on once a cluster is usable */

public interface AuxiliaryFeature {
    // short label for status messages, e.g. "auditing"
    String name();

    // switch the feature on for a ready cluster; failures are reported, never retried
    FeatureOutcome enable(String clusterName, String resourceId) throws ProviderException;
}
