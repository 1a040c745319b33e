package com.clusterops.provider;

/* Manage cluster lifecycle at an external provider */

public interface ClusterProvider {
    // short label used in log lines and status messages, e.g. "Atlas"
    String name();

    // request a new cluster; the provider only acknowledges, the cluster is built asynchronously
    CreateAck create(String name, Tier tier, String region) throws ProviderException;

    // check cluster status (returns ClusterLookup.notFound() before the provider can see it)
    ClusterLookup get(String name) throws ProviderException;

    // delete a cluster, or report that there is nothing to delete
    DeleteOutcome delete(String name) throws ProviderException;
}
