package com.clusterops.orchestrator;

import com.clusterops.provider.AuxiliaryFeature;
import com.clusterops.provider.ClusterProvider;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.quartz.SchedulerException;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Wires the orchestrator together and exposes what consumers may do with it: create, status,
 * cancel, list and clear-all. Call {@link #start()} before use and {@link #shutdown()} at exit.
 */
public class ProvisioningService {
    final static Logger LOG = LogManager.getLogger(ProvisioningService.class);

    static final String SWEEP_ID = "retention";

    private final OrchestratorConfig config;
    private final Clock clock;
    private final ExecutorService ownedIo;
    private final RequestRegistry registry;
    private final JobScheduler scheduler;
    private final LifecycleController controller;
    private final ReconciliationPoller poller;
    private final CancellationCoordinator cancellation;

    public ProvisioningService(OrchestratorConfig config, ClusterProvider provider, AuxiliaryFeature feature) throws SchedulerException {
        this(config, provider, feature, Clock.systemUTC(), null);
    }

    // io may be null, in which case the service runs its own pool
    ProvisioningService(OrchestratorConfig config, ClusterProvider provider, AuxiliaryFeature feature,
                        Clock clock, Executor io) throws SchedulerException {
        this.config = config;
        this.clock = clock;
        this.ownedIo = io == null ? Executors.newFixedThreadPool(config.getIoThreadCount()) : null;
        Executor executor = io == null ? ownedIo : io;
        String file = config.getPersistenceFile();
        this.registry = new RequestRegistry(file == null || file.isEmpty() ? null : Paths.get(file));
        this.scheduler = new JobScheduler(config.getSchedulerThreadCount());
        ProgressEstimator estimator = new ProgressEstimator(config.getNominalDurationMillis(), config.getProgressCap());
        NameResolver resolver = new NameResolver();
        this.controller = new LifecycleController(registry, provider, feature, estimator, resolver, scheduler,
                config, clock, executor);
        this.poller = new ReconciliationPoller(registry, provider, resolver, controller, scheduler,
                config.getPollIntervalMillis());
        this.cancellation = new CancellationCoordinator(registry, provider, scheduler, clock, executor,
                config.getDeletionPollIntervalMillis(), config.getDeletionMaxMillis());
        controller.wire(poller, cancellation);
        LOG.info("Orchestrator using provider " + provider.name() + ", post-ready feature " + feature.name());
    }

    /**
     * Load persisted requests, start the scheduler and resume whatever was in flight.
     */
    public void start() throws SchedulerException {
        registry.load();
        scheduler.start();
        controller.recover();
        scheduler.start(TimerKind.SWEEP, SWEEP_ID, config.getSweepIntervalMillis(), config.getSweepIntervalMillis(),
                RetentionSweepJob.class, this);
    }

    public String create(String name, String tier) throws ValidationException, ConflictException {
        return controller.create(name, tier);
    }

    public RequestStatus status(String id) throws UnknownRequestException {
        ProvisioningRequest r = registry.find(id);
        if (r == null) {
            throw new UnknownRequestException(id);
        }
        return RequestStatus.of(r);
    }

    // accepted even when the request is already finished; that case changes nothing
    public boolean cancel(String id, String comment) throws UnknownRequestException {
        controller.cancel(id, comment);
        return true;
    }

    public List<RequestStatus> list() {
        List<RequestStatus> out = new ArrayList<>();
        for (ProvisioningRequest r : registry.list()) {
            out.add(RequestStatus.of(r));
        }
        return out;
    }

    /**
     * Stop every timer, forget every request and delete the snapshot. Clusters at the provider
     * are left alone.
     *
     * @return number of requests dropped
     */
    public int clearAll() {
        for (ProvisioningRequest r : registry.list()) {
            scheduler.stopAll(r.getId());
        }
        int n = registry.clear();
        LOG.info("Cleared " + n + " requests");
        return n;
    }

    // periodic housekeeping: deadlines, retention and a summary line
    public void sweep() {
        int timedOut = controller.enforceDeadlines();
        List<ProvisioningRequest> removed = registry.sweep(clock.millis(), config.getFailedRetentionMillis(),
                config.getReadyRetentionMillis());
        for (ProvisioningRequest r : removed) {
            scheduler.stopAll(r.getId());
            LOG.info("Purged " + r);
        }
        Map<RequestState, Integer> summary = registry.summary();
        LOG.info("Registry: " + registry.size() + " requests " + summary + ", " + timedOut + " timed out, "
                + removed.size() + " purged, " + controller.featuresInFlight() + " post-ready tasks running");
    }

    public void shutdown() {
        LOG.info("Shutting down orchestrator");
        scheduler.shutdown();
        controller.awaitFeatures(10000L);
        if (ownedIo != null) {
            ownedIo.shutdown();
            try {
                if (!ownedIo.awaitTermination(10, TimeUnit.SECONDS)) {
                    ownedIo.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedIo.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        registry.persist();
        LOG.info("Saved " + registry.size() + " requests");
    }

    RequestRegistry getRegistry() {
        return registry;
    }

    JobScheduler getScheduler() {
        return scheduler;
    }
}
