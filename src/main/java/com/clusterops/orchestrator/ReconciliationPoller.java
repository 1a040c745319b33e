package com.clusterops.orchestrator;

import com.clusterops.provider.ClusterProvider;
import com.clusterops.provider.ProviderException;
import com.clusterops.provider.ProviderTransportException;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

/**
 * Periodically asks the provider what it knows about a creating cluster and hands the answer to
 * the {@link LifecycleController}. The poller itself never decides the request state.
 */
public class ReconciliationPoller {
    final static Logger LOG = LogManager.getLogger(ReconciliationPoller.class);

    private final RequestRegistry registry;
    private final ClusterProvider provider;
    private final NameResolver resolver;
    private final LifecycleController controller;
    private final JobScheduler scheduler;
    private final long intervalMillis;

    public ReconciliationPoller(RequestRegistry registry, ClusterProvider provider, NameResolver resolver,
                                LifecycleController controller, JobScheduler scheduler, long intervalMillis) {
        this.registry = registry;
        this.provider = provider;
        this.resolver = resolver;
        this.controller = controller;
        this.scheduler = scheduler;
        this.intervalMillis = intervalMillis;
    }

    public void start(String id, long delayMillis) {
        LOG.info("Status checks for " + id + " start in " + delayMillis / 1000 + "s, then every " + intervalMillis / 1000 + "s");
        scheduler.start(TimerKind.RECONCILE, id, delayMillis, intervalMillis, ReconcilePollJob.class, this);
    }

    public void stop(String id) {
        scheduler.stop(TimerKind.RECONCILE, id);
    }

    /**
     * One poll: check the deadline, query the provider under the current best name and report.
     */
    public void pollOnce(String id) {
        ProvisioningRequest r = registry.find(id);
        if (r == null || !r.getState().isProvisioning() || r.isCancelled()) {
            LOG.debug("Request " + id + " no longer provisioning, stopping status checks");
            stop(id);
            return;
        }
        if (controller.enforceDeadline(id)) {
            return;
        }
        NameResolver.Resolution resolution;
        try {
            LOG.debug("Checking status of " + r.getQueryName() + " for " + id);
            resolution = resolver.lookup(r, provider);
        } catch (ProviderTransportException e) {
            LOG.warn("Status check for " + r.getQueryName() + " did not complete, retrying next tick: " + e.getMessage());
            return;
        } catch (ProviderException e) {
            controller.onHardError(id, e);
            return;
        }
        if (!resolution.getLookup().isFound()) {
            LOG.info("Cluster " + r.getQueryName() + " not visible at " + provider.name() + " yet, continuing to monitor");
            return;
        }
        controller.onReconcile(id, resolution);
    }
}
