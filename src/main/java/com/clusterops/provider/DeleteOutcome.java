package com.clusterops.provider;

public enum DeleteOutcome {
    ACCEPTED,
    NOT_FOUND
}
