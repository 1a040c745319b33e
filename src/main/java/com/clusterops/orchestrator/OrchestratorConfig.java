package com.clusterops.orchestrator;

import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Properties;

/**
 * Typed view over the orchestrator's {@link Properties}. Every key has a default here; a properties
 * file only needs to carry what differs. Durations are milliseconds.
 */
public class OrchestratorConfig {
    final static Logger LOG = LogManager.getLogger(OrchestratorConfig.class);

    private final Properties params;

    public OrchestratorConfig() {
        this(new Properties());
    }

    public OrchestratorConfig(Properties overrides) {
        params = defaults();
        params.putAll(overrides);
    }

    public static OrchestratorConfig load(String file) throws IOException {
        Properties p = new Properties();
        try (Reader reader = new FileReader(file)) {
            p.load(reader);
        }
        LOG.info("Loaded " + p.size() + " properties from " + file);
        return new OrchestratorConfig(p);
    }

    public static Properties defaults() {
        Properties params = new Properties();
        params.setProperty("provider.type", "atlas");
        params.setProperty("provider.region", "US_EAST_1");
        params.setProperty("provider.callTimeoutMillis", "30000");
        params.setProperty("atlas.baseUrl", "https://cloud.mongodb.com/api/atlas/v1.0");
        params.setProperty("atlas.groupId", "");
        params.setProperty("atlas.accessToken", "");
        params.setProperty("atlas.providerName", "AWS");
        params.setProperty("atlas.mongoDBMajorVersion", "7.0");
        params.setProperty("rds.engine", "postgres");
        params.setProperty("rds.masterUsername", "clusteradmin");
        params.setProperty("rds.allocatedStorage", "100");
        params.setProperty("awsAccessKeyID", "");
        params.setProperty("awsSecretAccessKey", "");
        params.setProperty("feature.type", "auditing");
        params.setProperty("feature.timeoutMillis", "300000");
        params.setProperty("persistence.file", "cluster-requests.json");
        params.setProperty("progress.tickMillis", "1000");
        params.setProperty("progress.nominalDurationMillis", "480000");
        params.setProperty("progress.cap", "95");
        params.setProperty("poll.graceMillis", "30000");
        params.setProperty("poll.intervalMillis", "10000");
        params.setProperty("provisioning.maxDurationMillis", "86400000");
        params.setProperty("recovery.retentionMillis", "86400000");
        params.setProperty("deletion.pollIntervalMillis", "15000");
        params.setProperty("deletion.maxDurationMillis", "720000");
        params.setProperty("sweep.intervalMillis", "300000");
        params.setProperty("retention.failedMillis", "3600000");
        params.setProperty("retention.readyMillis", "86400000");
        params.setProperty("scheduler.threadCount", "10");
        params.setProperty("io.threadCount", "4");
        return params;
    }

    public String get(String key) {
        return params.getProperty(key);
    }

    public long getLong(String key) {
        String v = params.getProperty(key);
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("Property " + key + " must be a number, got: " + v, e);
        }
    }

    public int getInt(String key) {
        return (int) getLong(key);
    }

    public Properties asProperties() {
        Properties copy = new Properties();
        copy.putAll(params);
        return copy;
    }

    public String getProviderType() {
        return get("provider.type");
    }

    public String getRegion() {
        return get("provider.region");
    }

    public String getFeatureType() {
        return get("feature.type");
    }

    public long getFeatureTimeoutMillis() {
        return getLong("feature.timeoutMillis");
    }

    public String getPersistenceFile() {
        return get("persistence.file");
    }

    public long getProgressTickMillis() {
        return getLong("progress.tickMillis");
    }

    public long getNominalDurationMillis() {
        return getLong("progress.nominalDurationMillis");
    }

    public int getProgressCap() {
        return getInt("progress.cap");
    }

    public long getPollGraceMillis() {
        return getLong("poll.graceMillis");
    }

    public long getPollIntervalMillis() {
        return getLong("poll.intervalMillis");
    }

    public long getMaxProvisioningMillis() {
        return getLong("provisioning.maxDurationMillis");
    }

    public long getRecoveryRetentionMillis() {
        return getLong("recovery.retentionMillis");
    }

    public long getDeletionPollIntervalMillis() {
        return getLong("deletion.pollIntervalMillis");
    }

    public long getDeletionMaxMillis() {
        return getLong("deletion.maxDurationMillis");
    }

    public long getSweepIntervalMillis() {
        return getLong("sweep.intervalMillis");
    }

    public long getFailedRetentionMillis() {
        return getLong("retention.failedMillis");
    }

    public long getReadyRetentionMillis() {
        return getLong("retention.readyMillis");
    }

    public int getSchedulerThreadCount() {
        return getInt("scheduler.threadCount");
    }

    public int getIoThreadCount() {
        return getInt("io.threadCount");
    }
}
