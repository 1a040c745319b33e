package com.clusterops.provider;

/**
 * Result of a provider status query: either the cluster as the provider currently sees it,
 * or "not found" (normal while a freshly requested cluster is not yet visible).
 */
public class ClusterLookup {
    private static final ClusterLookup NOT_FOUND = new ClusterLookup(false, null, null, null, null, null, null);

    private final boolean found;
    private final String name;
    private final String resourceId;
    private final String providerState;
    private final ObservedState state;
    private final String connectionDescriptor;
    private final Integer progressHint;

    private ClusterLookup(boolean found, String name, String resourceId, String providerState,
                          ObservedState state, String connectionDescriptor, Integer progressHint) {
        this.found = found;
        this.name = name;
        this.resourceId = resourceId;
        this.providerState = providerState;
        this.state = state;
        this.connectionDescriptor = connectionDescriptor;
        this.progressHint = progressHint;
    }

    public static ClusterLookup notFound() {
        return NOT_FOUND;
    }

    public static ClusterLookup found(String name, String resourceId, String providerState, ObservedState state,
                                      String connectionDescriptor, Integer progressHint) {
        if (state == null) {
            throw new IllegalArgumentException("observed state is required for a found cluster");
        }
        return new ClusterLookup(true, name, resourceId, providerState, state, connectionDescriptor, progressHint);
    }

    public boolean isFound() {
        return found;
    }

    public String getName() {
        return name;
    }

    public String getResourceId() {
        return resourceId;
    }

    // raw status string as reported by the provider, e.g. "IDLE" or "creating"
    public String getProviderState() {
        return providerState;
    }

    public ObservedState getState() {
        return state;
    }

    public String getConnectionDescriptor() {
        return connectionDescriptor;
    }

    // provider-reported completion percentage, null when the provider does not report one
    public Integer getProgressHint() {
        return progressHint;
    }

    @Override
    public String toString() {
        if (!found) {
            return "ClusterLookup{notFound}";
        }
        return "ClusterLookup{name=" + name + ", resourceId=" + resourceId + ", state=" + state
                + " (" + providerState + ")}";
    }
}
