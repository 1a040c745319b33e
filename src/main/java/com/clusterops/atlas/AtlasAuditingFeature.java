package com.clusterops.atlas;

import com.clusterops.provider.AuxiliaryFeature;
import com.clusterops.provider.FeatureOutcome;
import com.clusterops.provider.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

/**
 * Turns on database auditing for the project once a cluster is ready. Audits everything,
 * including successful authorizations.
 */
public class AtlasAuditingFeature implements AuxiliaryFeature {
    final static Logger LOG = LogManager.getLogger(AtlasAuditingFeature.class);

    private final AtlasApiClient client;

    public AtlasAuditingFeature(AtlasApiClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return "auditing";
    }

    @Override
    public FeatureOutcome enable(String clusterName, String resourceId) throws ProviderException {
        ObjectNode body = client.mapper().createObjectNode();
        body.put("enabled", true);
        body.put("auditFilter", "{}");
        body.put("auditAuthorizationSuccess", true);
        LOG.info("Enabling database auditing for project of " + clusterName);
        JsonNode result = client.patch(client.projectPath("/auditLog"), body);
        if (result != null && result.path("enabled").asBoolean(false)) {
            return FeatureOutcome.enabled("Database auditing enabled");
        }
        return FeatureOutcome.notEnabled("Atlas did not confirm auditing: " + result);
    }
}
