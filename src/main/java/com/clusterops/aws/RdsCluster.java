package com.clusterops.aws;

import software.amazon.awssdk.services.rds.model.DBCluster;
import software.amazon.awssdk.utils.StringUtils;

/**
 * The parts of an RDS DB cluster description the orchestrator cares about.
 */
public class RdsCluster {
    public String clusterId, resourceId, status, engine, instanceClass, endpoint, readerEndpoint;
    public Integer port, percentProgress;
    boolean multiAz;

    public RdsCluster() {

    }

    public RdsCluster(DBCluster cluster) {
        update(cluster);
    }

    public void update(DBCluster cluster) {
        this.clusterId = cluster.dbClusterIdentifier();
        this.resourceId = cluster.dbClusterResourceId();
        this.status = cluster.status();
        this.engine = cluster.engine();
        this.instanceClass = cluster.dbClusterInstanceClass();
        this.endpoint = cluster.endpoint();
        this.readerEndpoint = cluster.readerEndpoint();
        this.port = cluster.port();
        this.multiAz = Boolean.TRUE.equals(cluster.multiAZ());
        // RDS reports this as a string, and only while an operation is running
        String pct = cluster.percentProgress();
        try {
            this.percentProgress = StringUtils.isBlank(pct) ? null : Integer.valueOf(pct.trim());
        } catch (NumberFormatException e) {
            this.percentProgress = null;
        }
    }

    // engine URI for clients, null until RDS has assigned an endpoint
    public String connectionDescriptor() {
        if (StringUtils.isEmpty(endpoint)) {
            return null;
        }
        return (engine == null ? "rds" : engine) + "://" + endpoint + (port != null ? ":" + port : "");
    }
}
