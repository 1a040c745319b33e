package com.clusterops.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What a consumer sees of a request. Read-only snapshot, safe to serialize.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RequestStatus {
    private final String id;
    private final String clusterName;
    private final String canonicalName;
    private final String tier;
    private final RequestState state;
    private final int progressPercent;
    private final String statusMessage;
    private final String connectionDescriptor;
    private final boolean cancelled;
    private final long startedAt;
    private final boolean featureTriggered;
    private final boolean featureEnabled;
    private final boolean featureFailed;
    private final String featureMessage;

    private RequestStatus(ProvisioningRequest r) {
        this.id = r.getId();
        this.clusterName = r.getDesiredName();
        this.canonicalName = r.getCanonicalName();
        this.tier = r.getTier() == null ? null : r.getTier().name();
        this.state = r.getState();
        this.progressPercent = r.getProgressPercent();
        this.statusMessage = r.getLastStatusMessage();
        this.connectionDescriptor = r.getCanonicalName() == null ? null : r.getConnectionDescriptor();
        this.cancelled = r.isCancelled();
        this.startedAt = r.getStartedAt();
        this.featureTriggered = r.getFeature().isTriggered();
        this.featureEnabled = r.getFeature().isEnabled();
        this.featureFailed = r.getFeature().isFailed();
        this.featureMessage = r.getFeature().getMessage();
    }

    public static RequestStatus of(ProvisioningRequest r) {
        return new RequestStatus(r);
    }

    public String getId() {
        return id;
    }

    public String getClusterName() {
        return clusterName;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public String getTier() {
        return tier;
    }

    public RequestState getState() {
        return state;
    }

    public int getProgressPercent() {
        return progressPercent;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public String getConnectionDescriptor() {
        return connectionDescriptor;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public long getStartedAt() {
        return startedAt;
    }

    public boolean isFeatureTriggered() {
        return featureTriggered;
    }

    public boolean isFeatureEnabled() {
        return featureEnabled;
    }

    public boolean isFeatureFailed() {
        return featureFailed;
    }

    public String getFeatureMessage() {
        return featureMessage;
    }

    @Override
    public String toString() {
        return id + " " + clusterName + " " + state + " " + progressPercent + "% - " + statusMessage;
    }
}
