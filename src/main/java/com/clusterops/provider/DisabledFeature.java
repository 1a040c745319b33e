package com.clusterops.provider;

// used when no post-ready feature is configured
public class DisabledFeature implements AuxiliaryFeature {
    @Override
    public String name() {
        return "none";
    }

    @Override
    public FeatureOutcome enable(String clusterName, String resourceId) {
        return FeatureOutcome.notEnabled("No post-ready feature configured");
    }
}
