package com.clusterops.orchestrator;

import com.clusterops.provider.ClusterLookup;
import com.clusterops.provider.ClusterProvider;
import com.clusterops.provider.CreateAck;
import com.clusterops.provider.ProviderException;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

/**
 * Keeps track of which name the provider actually knows a cluster by. The name a user asked for
 * and the name the provider filed the cluster under can differ, and a create acknowledgement may
 * carry several fields that merely look like names.
 *
 * <p>Only two things set the canonical name: an explicit name in the acknowledgement, or a lookup
 * that found the cluster.
 */
public class NameResolver {
    final static Logger LOG = LogManager.getLogger(NameResolver.class);

    /** A lookup together with the canonical name it established, if any. */
    public static class Resolution {
        private final ClusterLookup lookup;
        private final String adoptedName;
        private final boolean fallbackUsed;

        Resolution(ClusterLookup lookup, String adoptedName, boolean fallbackUsed) {
            this.lookup = lookup;
            this.adoptedName = adoptedName;
            this.fallbackUsed = fallbackUsed;
        }

        public ClusterLookup getLookup() {
            return lookup;
        }

        // null unless the lookup found the cluster
        public String getAdoptedName() {
            return adoptedName;
        }

        public boolean isFallbackUsed() {
            return fallbackUsed;
        }
    }

    // canonical name from a create acknowledgement, null when the provider did not say
    public String initialCanonical(String desiredName, CreateAck ack) {
        if (ack == null) {
            return null;
        }
        for (String hint : ack.getNameHints()) {
            if (hint != null && !hint.equals(desiredName)) {
                LOG.info("Create response for " + desiredName + " mentions '" + hint + "', not using it until a lookup confirms it");
            }
        }
        String name = ack.getName();
        if (name == null || name.trim().isEmpty()) {
            return null;
        }
        if (!name.equals(desiredName)) {
            LOG.warn("Provider filed " + desiredName + " as " + name);
        }
        return name;
    }

    /**
     * Look the cluster up under its query name. When that misses and the canonical name differs
     * from the requested one, look once more under the requested name.
     */
    public Resolution lookup(ProvisioningRequest r, ClusterProvider provider) throws ProviderException {
        String query = r.getQueryName();
        ClusterLookup result = provider.get(query);
        if (result.isFound()) {
            return new Resolution(result, result.getName() != null ? result.getName() : query, false);
        }
        String desired = r.getDesiredName();
        if (r.getCanonicalName() != null && !desired.equals(r.getCanonicalName())) {
            LOG.info("Cluster not found as " + query + ", trying requested name " + desired);
            ClusterLookup retry = provider.get(desired);
            if (retry.isFound()) {
                LOG.info("Found cluster using requested name " + desired + ", using it from now on");
                return new Resolution(retry, retry.getName() != null ? retry.getName() : desired, true);
            }
        }
        return new Resolution(result, null, false);
    }
}
