package com.clusterops.provider;

public class FeatureOutcome {
    private final boolean enabled;
    private final String message;

    private FeatureOutcome(boolean enabled, String message) {
        this.enabled = enabled;
        this.message = message;
    }

    public static FeatureOutcome enabled(String message) {
        return new FeatureOutcome(true, message);
    }

    public static FeatureOutcome notEnabled(String message) {
        return new FeatureOutcome(false, message);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getMessage() {
        return message;
    }
}
