package com.clusterops.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Provider acknowledgement of a create call.
 *
 * <p>{@code name} is only set when the provider explicitly reports the name it filed the cluster
 * under. Anything else that merely looks like a name goes into {@code nameHints} and is not
 * trusted for later lookups.
 */
public class CreateAck {
    private final String resourceId;
    private final String name;
    private final String providerState;
    private final List<String> nameHints;

    public CreateAck(String resourceId, String name, String providerState) {
        this(resourceId, name, providerState, Collections.emptyList());
    }

    public CreateAck(String resourceId, String name, String providerState, List<String> nameHints) {
        this.resourceId = resourceId;
        this.name = name;
        this.providerState = providerState;
        this.nameHints = Collections.unmodifiableList(new ArrayList<>(nameHints));
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getName() {
        return name;
    }

    public String getProviderState() {
        return providerState;
    }

    public List<String> getNameHints() {
        return nameHints;
    }

    @Override
    public String toString() {
        return "CreateAck{resourceId=" + resourceId + ", name=" + name + ", state=" + providerState
                + ", hints=" + nameHints + "}";
    }
}
