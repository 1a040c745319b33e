package com.clusterops.atlas;

import com.clusterops.provider.ClusterLookup;
import com.clusterops.provider.ClusterProvider;
import com.clusterops.provider.CreateAck;
import com.clusterops.provider.DeleteOutcome;
import com.clusterops.provider.ObservedState;
import com.clusterops.provider.ProviderErrorException;
import com.clusterops.provider.ProviderException;
import com.clusterops.provider.Tier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * MongoDB Atlas replica sets as a {@link ClusterProvider}.
 */
public class AtlasClusterProvider implements ClusterProvider {
    final static Logger LOG = LogManager.getLogger(AtlasClusterProvider.class);

    private static final String NOT_FOUND_CODE = "CLUSTER_NOT_FOUND";
    private static final String NOT_FOUND_DETAIL = "No cluster named";
    // Atlas object ids are 24 hex characters; anything else in "id" might be a name
    private static final Pattern OBJECT_ID = Pattern.compile("^[0-9a-fA-F]{24}$");
    private static final Pattern NAME_LIKE = Pattern.compile("^[a-zA-Z0-9-]+$");

    private final AtlasApiClient client;
    private final String providerName;
    private final String mongoDBMajorVersion;

    public AtlasClusterProvider(AtlasApiClient client, String providerName, String mongoDBMajorVersion) {
        this.client = client;
        this.providerName = providerName;
        this.mongoDBMajorVersion = mongoDBMajorVersion;
    }

    public AtlasClusterProvider(Properties params) {
        this(new AtlasApiClient(params), params.getProperty("atlas.providerName", "AWS"),
                params.getProperty("atlas.mongoDBMajorVersion", "7.0"));
    }

    @Override
    public String name() {
        return "Atlas";
    }

    @Override
    public CreateAck create(String name, Tier tier, String region) throws ProviderException {
        JsonNode result = client.post(client.projectPath("/clusters"), clusterConfig(name, tier, region));
        if (result == null || !result.isObject()) {
            throw ProviderErrorException.malformed("Unexpected response format", null);
        }
        String id = text(result, "id");
        List<String> hints = new ArrayList<>();
        if (id != null && !OBJECT_ID.matcher(id).matches() && NAME_LIKE.matcher(id).matches()) {
            hints.add(id);
        }
        String clusterName = text(result, "clusterName");
        if (clusterName != null) {
            hints.add(clusterName);
        }
        CreateAck ack = new CreateAck(id, text(result, "name"), text(result, "stateName"), hints);
        LOG.info("Atlas accepted cluster " + name + ": " + ack);
        return ack;
    }

    ObjectNode clusterConfig(String name, Tier tier, String region) {
        ObjectNode body = client.mapper().createObjectNode();
        body.put("name", name);
        body.put("clusterType", "REPLICASET");
        body.put("mongoDBMajorVersion", mongoDBMajorVersion);
        ArrayNode specs = body.putArray("replicationSpecs");
        ObjectNode spec = specs.addObject();
        spec.put("numShards", 1);
        ObjectNode regionsConfig = spec.putObject("regionsConfig").putObject(region);
        regionsConfig.put("electableNodes", 3);
        regionsConfig.put("priority", 7);
        regionsConfig.put("readOnlyNodes", 0);
        ObjectNode settings = body.putObject("providerSettings");
        settings.put("providerName", providerName);
        settings.put("instanceSizeName", tier.getAtlasSize());
        settings.put("regionName", region);
        return body;
    }

    @Override
    public ClusterLookup get(String name) throws ProviderException {
        JsonNode result;
        try {
            result = client.get(client.projectPath("/clusters/" + AtlasApiClient.encode(name)));
        } catch (ProviderErrorException e) {
            if (isNotFound(e)) {
                return ClusterLookup.notFound();
            }
            throw e;
        }
        String stateName = result == null ? null : text(result, "stateName");
        if (stateName == null) {
            throw ProviderErrorException.malformed("Unexpected response format", null);
        }
        JsonNode strings = result.path("connectionStrings");
        String connection = text(strings, "standardSrv");
        if (connection == null) {
            connection = text(strings, "standard");
        }
        String found = text(result, "name");
        return ClusterLookup.found(found != null ? found : name, text(result, "id"), stateName,
                mapState(stateName), connection, null);
    }

    @Override
    public DeleteOutcome delete(String name) throws ProviderException {
        try {
            client.delete(client.projectPath("/clusters/" + AtlasApiClient.encode(name)));
            return DeleteOutcome.ACCEPTED;
        } catch (ProviderErrorException e) {
            if (isNotFound(e)) {
                return DeleteOutcome.NOT_FOUND;
            }
            throw e;
        }
    }

    static boolean isNotFound(ProviderErrorException e) {
        return NOT_FOUND_CODE.equals(e.getErrorCode())
                || (e.getDetail() != null && e.getDetail().contains(NOT_FOUND_DETAIL));
    }

    static ObservedState mapState(String stateName) {
        switch (stateName) {
            case "IDLE":
                return ObservedState.READY;
            case "CREATING":
                return ObservedState.PROVISIONING;
            case "FAILED":
                return ObservedState.FAILED;
            case "DELETING":
            case "DELETED":
                return ObservedState.DELETING;
            default:
                return ObservedState.OTHER;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
