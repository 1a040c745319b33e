package com.clusterops.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Outcome of the post-ready side effect. Kept apart from the request state: a failed feature
 * never makes a ready cluster less ready.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeatureStatus {
    private boolean triggered;
    private boolean enabled;
    private boolean failed;
    private String message;
    private Long completedAt;

    public FeatureStatus() {
    }

    public FeatureStatus(FeatureStatus other) {
        this.triggered = other.triggered;
        this.enabled = other.enabled;
        this.failed = other.failed;
        this.message = other.message;
        this.completedAt = other.completedAt;
    }

    public boolean isTriggered() {
        return triggered;
    }

    public void setTriggered(boolean triggered) {
        this.triggered = triggered;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isFailed() {
        return failed;
    }

    public void setFailed(boolean failed) {
        this.failed = failed;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Long getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Long completedAt) {
        this.completedAt = completedAt;
    }

    // triggered but neither outcome recorded yet
    @JsonIgnore
    public boolean isPending() {
        return triggered && completedAt == null;
    }
}
