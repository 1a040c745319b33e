package com.clusterops.orchestrator;

import com.clusterops.provider.Tier;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One tracked attempt to create a cluster. The request id is ours; the provider's identity for
 * the cluster lives in {@code canonicalName} and {@code providerResourceId}.
 *
 * <p>Instances held by {@link RequestRegistry} are only changed inside
 * {@link RequestRegistry#update}; everything handed out by the registry is a copy.
 * All timestamps are epoch milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProvisioningRequest {
    private String id;
    private String desiredName;
    private String canonicalName;
    private Tier tier;
    private String region;
    private RequestState state;
    private int progressPercent;
    private int progressFloor;
    private long startedAt;
    private long updatedAt;
    private Long finishedAt;
    private String lastStatusMessage;
    private String providerResourceId;
    private String providerState;
    private String connectionDescriptor;
    private boolean cancelled;
    private String cancelReason;
    private Long deleteRequestedAt;
    private boolean deleteIssued;
    private FeatureStatus feature = new FeatureStatus();

    public ProvisioningRequest() {
    }

    public ProvisioningRequest(String id, String desiredName, Tier tier, String region, long startedAt) {
        this.id = id;
        this.desiredName = desiredName;
        this.tier = tier;
        this.region = region;
        this.state = RequestState.INITIALIZING;
        this.startedAt = startedAt;
        this.updatedAt = startedAt;
        this.lastStatusMessage = "Initializing cluster creation...";
    }

    public ProvisioningRequest(ProvisioningRequest other) {
        this.id = other.id;
        this.desiredName = other.desiredName;
        this.canonicalName = other.canonicalName;
        this.tier = other.tier;
        this.region = other.region;
        this.state = other.state;
        this.progressPercent = other.progressPercent;
        this.progressFloor = other.progressFloor;
        this.startedAt = other.startedAt;
        this.updatedAt = other.updatedAt;
        this.finishedAt = other.finishedAt;
        this.lastStatusMessage = other.lastStatusMessage;
        this.providerResourceId = other.providerResourceId;
        this.providerState = other.providerState;
        this.connectionDescriptor = other.connectionDescriptor;
        this.cancelled = other.cancelled;
        this.cancelReason = other.cancelReason;
        this.deleteRequestedAt = other.deleteRequestedAt;
        this.deleteIssued = other.deleteIssued;
        this.feature = other.feature == null ? new FeatureStatus() : new FeatureStatus(other.feature);
    }

    // name to use for provider lookups: the canonical one once known
    @JsonIgnore
    public String getQueryName() {
        return canonicalName != null ? canonicalName : desiredName;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }

    // a request that still holds its name: anything except FAILED (and removed records)
    @JsonIgnore
    public boolean holdsName(String name) {
        if (state == RequestState.FAILED || state == RequestState.DELETED) {
            return false;
        }
        return name.equals(desiredName) || name.equals(canonicalName);
    }

    // move to a terminal or deleting state, stamping the time of the transition
    public void transition(RequestState next, long now) {
        this.state = next;
        this.updatedAt = now;
        if (next.isTerminal()) {
            this.finishedAt = now;
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDesiredName() {
        return desiredName;
    }

    public void setDesiredName(String desiredName) {
        this.desiredName = desiredName;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public void setCanonicalName(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public Tier getTier() {
        return tier;
    }

    public void setTier(Tier tier) {
        this.tier = tier;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public RequestState getState() {
        return state;
    }

    public void setState(RequestState state) {
        this.state = state;
    }

    public int getProgressPercent() {
        return progressPercent;
    }

    public void setProgressPercent(int progressPercent) {
        this.progressPercent = progressPercent;
    }

    public int getProgressFloor() {
        return progressFloor;
    }

    public void setProgressFloor(int progressFloor) {
        this.progressFloor = progressFloor;
    }

    public long getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(long startedAt) {
        this.startedAt = startedAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Long getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Long finishedAt) {
        this.finishedAt = finishedAt;
    }

    public String getLastStatusMessage() {
        return lastStatusMessage;
    }

    public void setLastStatusMessage(String lastStatusMessage) {
        this.lastStatusMessage = lastStatusMessage;
    }

    public String getProviderResourceId() {
        return providerResourceId;
    }

    public void setProviderResourceId(String providerResourceId) {
        this.providerResourceId = providerResourceId;
    }

    public String getProviderState() {
        return providerState;
    }

    public void setProviderState(String providerState) {
        this.providerState = providerState;
    }

    public String getConnectionDescriptor() {
        return connectionDescriptor;
    }

    public void setConnectionDescriptor(String connectionDescriptor) {
        this.connectionDescriptor = connectionDescriptor;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void setCancelled(boolean cancelled) {
        this.cancelled = cancelled;
    }

    public String getCancelReason() {
        return cancelReason;
    }

    public void setCancelReason(String cancelReason) {
        this.cancelReason = cancelReason;
    }

    public Long getDeleteRequestedAt() {
        return deleteRequestedAt;
    }

    public void setDeleteRequestedAt(Long deleteRequestedAt) {
        this.deleteRequestedAt = deleteRequestedAt;
    }

    public boolean isDeleteIssued() {
        return deleteIssued;
    }

    public void setDeleteIssued(boolean deleteIssued) {
        this.deleteIssued = deleteIssued;
    }

    public FeatureStatus getFeature() {
        return feature;
    }

    public void setFeature(FeatureStatus feature) {
        this.feature = feature == null ? new FeatureStatus() : feature;
    }

    @Override
    public String toString() {
        return id + ": " + desiredName + (canonicalName != null && !canonicalName.equals(desiredName) ? " (" + canonicalName + ")" : "")
                + " (" + state + ") - " + progressPercent + "%";
    }
}
