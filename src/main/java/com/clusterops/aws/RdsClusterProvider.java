package com.clusterops.aws;

import com.clusterops.provider.ClusterLookup;
import com.clusterops.provider.ClusterProvider;
import com.clusterops.provider.CreateAck;
import com.clusterops.provider.DeleteOutcome;
import com.clusterops.provider.ObservedState;
import com.clusterops.provider.ProviderErrorException;
import com.clusterops.provider.ProviderException;
import com.clusterops.provider.ProviderTransportException;
import com.clusterops.provider.Tier;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.CreateDbClusterRequest;
import software.amazon.awssdk.services.rds.model.CreateDbClusterResponse;
import software.amazon.awssdk.services.rds.model.DBCluster;
import software.amazon.awssdk.services.rds.model.DbClusterNotFoundException;
import software.amazon.awssdk.services.rds.model.DeleteDbClusterRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersRequest;
import software.amazon.awssdk.services.rds.model.DescribeDbClustersResponse;
import software.amazon.awssdk.utils.StringUtils;

import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Amazon RDS Multi-AZ DB clusters as a {@link ClusterProvider}. RDS stores cluster identifiers in
 * lower case, so the identifier it reports back is the canonical name.
 */
public class RdsClusterProvider implements ClusterProvider {
    final static Logger LOG = LogManager.getLogger(RdsClusterProvider.class);

    private final RdsClient rds;
    private final String engine;
    private final String masterUsername;
    private final int allocatedStorage;

    public RdsClusterProvider(Properties params) {
        this(buildClient(params), params);
    }

    public RdsClusterProvider(RdsClient rds, Properties params) {
        this.rds = rds;
        this.engine = params.getProperty("rds.engine", "postgres");
        this.masterUsername = params.getProperty("rds.masterUsername", "clusteradmin");
        this.allocatedStorage = Integer.parseInt(params.getProperty("rds.allocatedStorage", "100"));
    }

    static RdsClient buildClient(Properties params) {
        // explicit keys win; otherwise the SDK's default credential chain applies
        if (!StringUtils.isEmpty(params.getProperty("awsAccessKeyID"))) {
            System.setProperty("aws.accessKeyId", params.getProperty("awsAccessKeyID"));
            System.setProperty("aws.secretAccessKey", params.getProperty("awsSecretAccessKey"));
        }
        long timeout = Long.parseLong(params.getProperty("provider.callTimeoutMillis", "30000"));
        return RdsClient.builder()
                .region(Region.of(params.getProperty("provider.region")))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(Duration.ofMillis(timeout))
                        .build())
                .build();
    }

    @Override
    public String name() {
        return "RDS";
    }

    static String instanceClass(Tier tier) {
        switch (tier) {
            case SMALL:
                return "db.m6gd.large";
            case MEDIUM:
                return "db.m6gd.xlarge";
            default:
                return "db.m6gd.2xlarge";
        }
    }

    @Override
    public CreateAck create(String name, Tier tier, String region) throws ProviderException {
        CreateDbClusterRequest request = CreateDbClusterRequest.builder()
                .dbClusterIdentifier(name)
                .engine(engine)
                .dbClusterInstanceClass(instanceClass(tier))
                .storageType("gp3")
                .allocatedStorage(allocatedStorage)
                .masterUsername(masterUsername)
                .manageMasterUserPassword(true)
                .build();
        try {
            CreateDbClusterResponse response = rds.createDBCluster(request);
            RdsCluster cluster = new RdsCluster(response.dbCluster());
            LOG.info("RDS accepted cluster " + name + " as " + cluster.clusterId + " (" + cluster.status + ")");
            return new CreateAck(cluster.resourceId, cluster.clusterId, cluster.status);
        } catch (SdkClientException e) {
            throw new ProviderTransportException("CreateDBCluster " + name + " failed: " + e.getMessage(), e);
        } catch (AwsServiceException e) {
            throw serviceError(e);
        }
    }

    @Override
    public ClusterLookup get(String name) throws ProviderException {
        try {
            DescribeDbClustersResponse response = rds.describeDBClusters(DescribeDbClustersRequest.builder()
                    .dbClusterIdentifier(name).build());
            for (DBCluster c : response.dbClusters()) {
                if (c.dbClusterIdentifier() != null && c.dbClusterIdentifier().equalsIgnoreCase(name)) {
                    RdsCluster cluster = new RdsCluster(c);
                    return ClusterLookup.found(cluster.clusterId, cluster.resourceId, cluster.status,
                            mapState(cluster.status), cluster.connectionDescriptor(), cluster.percentProgress);
                }
            }
            return ClusterLookup.notFound();
        } catch (DbClusterNotFoundException e) {
            return ClusterLookup.notFound();
        } catch (SdkClientException e) {
            throw new ProviderTransportException("DescribeDBClusters " + name + " failed: " + e.getMessage(), e);
        } catch (AwsServiceException e) {
            throw serviceError(e);
        }
    }

    @Override
    public DeleteOutcome delete(String name) throws ProviderException {
        try {
            rds.deleteDBCluster(DeleteDbClusterRequest.builder()
                    .dbClusterIdentifier(name)
                    .skipFinalSnapshot(true)
                    .build());
            LOG.info("RDS accepted delete of " + name);
            return DeleteOutcome.ACCEPTED;
        } catch (DbClusterNotFoundException e) {
            return DeleteOutcome.NOT_FOUND;
        } catch (SdkClientException e) {
            throw new ProviderTransportException("DeleteDBCluster " + name + " failed: " + e.getMessage(), e);
        } catch (AwsServiceException e) {
            throw serviceError(e);
        }
    }

    // throttling says nothing about the cluster, so it is treated like a connection problem
    private static ProviderException serviceError(AwsServiceException e) {
        if (e.isThrottlingException()) {
            return new ProviderTransportException("RDS throttled the request: " + e.getMessage(), e);
        }
        String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
        String detail = e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null
                ? e.awsErrorDetails().errorMessage() : e.getMessage();
        return new ProviderErrorException(code, detail, e);
    }

    static ObservedState mapState(String status) {
        if (status == null) {
            return ObservedState.OTHER;
        }
        String s = status.toLowerCase(Locale.ROOT);
        if (s.equals("available")) {
            return ObservedState.READY;
        }
        if (s.equals("creating") || s.equals("backing-up") || s.startsWith("configuring-")) {
            return ObservedState.PROVISIONING;
        }
        if (s.equals("failed") || s.startsWith("inaccessible-encryption-credentials") || s.startsWith("incompatible-")) {
            return ObservedState.FAILED;
        }
        if (s.equals("deleting")) {
            return ObservedState.DELETING;
        }
        return ObservedState.OTHER;
    }
}
