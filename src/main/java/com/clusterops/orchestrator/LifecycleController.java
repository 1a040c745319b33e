package com.clusterops.orchestrator;

import com.clusterops.provider.AuxiliaryFeature;
import com.clusterops.provider.ClusterLookup;
import com.clusterops.provider.ClusterProvider;
import com.clusterops.provider.CreateAck;
import com.clusterops.provider.FeatureOutcome;
import com.clusterops.provider.ProviderException;
import com.clusterops.provider.Tier;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Owns the request state machine:
 * INITIALIZING to CREATING to READY or FAILED, and DELETING to DELETED once cancelled.
 *
 * <p>Every transition is decided inside {@link RequestRegistry#update}, so when two handlers race
 * on one request the loser sees the new state and backs off. Provider calls never run under the
 * registry lock: the create call and the post-ready feature run on the I/O executor, polls on the
 * scheduler's workers.
 */
public class LifecycleController {
    final static Logger LOG = LogManager.getLogger(LifecycleController.class);

    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9-]+$");
    private static final int MAX_NAME_LENGTH = 64;

    private final RequestRegistry registry;
    private final ClusterProvider provider;
    private final AuxiliaryFeature feature;
    private final ProgressEstimator estimator;
    private final NameResolver resolver;
    private final JobScheduler scheduler;
    private final OrchestratorConfig config;
    private final Clock clock;
    private final Executor io;
    private final Set<CompletableFuture<Void>> featuresInFlight = ConcurrentHashMap.newKeySet();

    private ReconciliationPoller poller;
    private CancellationCoordinator cancellation;
    private long lastId;

    public LifecycleController(RequestRegistry registry, ClusterProvider provider, AuxiliaryFeature feature,
                               ProgressEstimator estimator, NameResolver resolver, JobScheduler scheduler,
                               OrchestratorConfig config, Clock clock, Executor io) {
        this.registry = registry;
        this.provider = provider;
        this.feature = feature;
        this.estimator = estimator;
        this.resolver = resolver;
        this.scheduler = scheduler;
        this.config = config;
        this.clock = clock;
        this.io = io;
    }

    // the poller and the coordinator call back into the controller, so they are wired after construction
    public void wire(ReconciliationPoller poller, CancellationCoordinator cancellation) {
        this.poller = poller;
        this.cancellation = cancellation;
    }

    public static void validate(String name, String tier) throws ValidationException {
        if (name == null || name.isEmpty() || tier == null || tier.isEmpty()) {
            throw new ValidationException("Cluster name and tier are required");
        }
        if (name.length() > MAX_NAME_LENGTH || !NAME_PATTERN.matcher(name).matches()) {
            throw new ValidationException("Cluster name must be 1-64 characters, letters, numbers, and hyphens only");
        }
        if (Tier.parse(tier) == null) {
            throw new ValidationException("Invalid tier '" + tier + "'. Must be one of: SMALL (M10), MEDIUM (M20), LARGE (M30)");
        }
    }

    /**
     * Register a new request and fire the provider create call in the background.
     *
     * @return the new request id
     */
    public String create(String name, String tierValue) throws ValidationException, ConflictException {
        validate(name, tierValue);
        Tier tier = Tier.parse(tierValue);
        long now = clock.millis();
        ProvisioningRequest record = new ProvisioningRequest(nextId(now), name, tier, config.getRegion(), now);
        registry.insertIfNameAvailable(record);
        LOG.info("Created request " + record.getId() + " for cluster " + name + " (" + tier + ")");
        io.execute(() -> issueCreate(record.getId(), name, tier, record.getRegion()));
        return record.getId();
    }

    private synchronized String nextId(long now) {
        lastId = Math.max(now, lastId + 1);
        return "req-" + lastId;
    }

    void issueCreate(String id, String name, Tier tier, String region) {
        CreateAck ack;
        try {
            LOG.info("Requesting cluster " + name + " from " + provider.name());
            ack = provider.create(name, tier, region);
        } catch (ProviderException e) {
            onCreateFailed(id, e.getDetail(), e);
            return;
        } catch (RuntimeException e) {
            onCreateFailed(id, String.valueOf(e.getMessage()), e);
            return;
        }
        onCreateAck(id, name, ack);
    }

    public void onCreateAck(String id, String desiredName, CreateAck ack) {
        LOG.info("Create acknowledged for " + id + ": " + ack);
        String canonical = resolver.initialCanonical(desiredName, ack);
        long now = clock.millis();
        ProvisioningRequest updated = registry.update(id, r -> {
            if (!r.isCancelled() && r.getState() != RequestState.INITIALIZING) {
                return false;
            }
            if (ack.getResourceId() != null) {
                r.setProviderResourceId(ack.getResourceId());
            }
            if (canonical != null) {
                r.setCanonicalName(canonical);
            }
            r.setProviderState(ack.getProviderState());
            if (r.isCancelled()) {
                return true;
            }
            r.transition(RequestState.CREATING, now);
            estimator.raiseFloor(r, ProgressEstimator.ACCEPTED);
            r.setLastStatusMessage("Cluster creation in progress at " + provider.name() + "...");
            return true;
        });
        if (updated == null) {
            if (!registry.contains(id)) {
                LOG.warn("Request " + id + " disappeared while " + desiredName + " was being created");
                cancellation.deleteOrphan(canonical != null ? canonical : desiredName);
            }
            return;
        }
        if (updated.isCancelled()) {
            cancellation.onLateAck(updated);
            return;
        }
        scheduler.start(TimerKind.PROGRESS, id, config.getProgressTickMillis(), config.getProgressTickMillis(),
                ProgressTickJob.class, this);
        poller.start(id, config.getPollGraceMillis());
    }

    public void onCreateFailed(String id, String detail, Throwable cause) {
        LOG.error("Failed to create cluster for " + id + ": " + detail, cause);
        long now = clock.millis();
        registry.update(id, r -> {
            if (r.getState() != RequestState.INITIALIZING || r.isCancelled()) {
                return false;
            }
            estimator.fail(r);
            r.transition(RequestState.FAILED, now);
            r.setLastStatusMessage("Failed to create cluster: " + detail);
            return true;
        });
    }

    // progress timer callback; stops its own timer once the request is no longer provisioning
    public void tickProgress(String id) {
        ProvisioningRequest current = registry.find(id);
        if (current == null || !current.getState().isProvisioning() || current.isCancelled()) {
            scheduler.stop(TimerKind.PROGRESS, id);
            return;
        }
        long now = clock.millis();
        registry.update(id, r -> !r.isCancelled() && estimator.tick(r, now));
    }

    /**
     * A poll found the cluster. Decide what the observed provider state means for the request.
     */
    public void onReconcile(String id, NameResolver.Resolution resolution) {
        ClusterLookup lookup = resolution.getLookup();
        String adopted = resolution.getAdoptedName();
        long now = clock.millis();
        switch (lookup.getState()) {
            case READY: {
                ProvisioningRequest ready = registry.update(id, r -> {
                    if (!r.getState().isProvisioning() || r.isCancelled()) {
                        return false;
                    }
                    adopt(r, adopted, lookup);
                    r.setConnectionDescriptor(lookup.getConnectionDescriptor());
                    estimator.complete(r);
                    r.transition(RequestState.READY, now);
                    r.setLastStatusMessage("Cluster " + r.getQueryName() + " is ready");
                    // only reachable once per request, so the feature runs once
                    r.getFeature().setTriggered(true);
                    return true;
                });
                if (ready != null) {
                    stopTimers(id);
                    LOG.info("Cluster " + ready.getQueryName() + " is ready (" + id + ")");
                    runFeature(ready);
                }
                break;
            }
            case FAILED: {
                ProvisioningRequest failed = registry.update(id, r -> {
                    if (!r.getState().isProvisioning() || r.isCancelled()) {
                        return false;
                    }
                    adopt(r, adopted, lookup);
                    estimator.fail(r);
                    r.transition(RequestState.FAILED, now);
                    r.setLastStatusMessage("Cluster creation failed at " + provider.name() + " (state " + lookup.getProviderState() + ")");
                    return true;
                });
                if (failed != null) {
                    stopTimers(id);
                    LOG.error("Cluster " + failed.getQueryName() + " failed at " + provider.name() + " (" + id + ")");
                }
                break;
            }
            case PROVISIONING:
                registry.update(id, r -> {
                    if (!r.getState().isProvisioning() || r.isCancelled()) {
                        return false;
                    }
                    adopt(r, adopted, lookup);
                    if (r.getState() == RequestState.INITIALIZING) {
                        r.transition(RequestState.CREATING, now);
                    }
                    estimator.onPoll(r, now, lookup.getProgressHint());
                    r.setUpdatedAt(now);
                    r.setLastStatusMessage("Cluster creation in progress at " + provider.name() + "... ("
                            + (now - r.getStartedAt()) / 1000 + "s)");
                    return true;
                });
                break;
            default:
                registry.update(id, r -> {
                    if (!r.getState().isProvisioning() || r.isCancelled()) {
                        return false;
                    }
                    adopt(r, adopted, lookup);
                    r.setUpdatedAt(now);
                    r.setLastStatusMessage("Cluster is " + lookup.getProviderState() + " at " + provider.name());
                    return true;
                });
        }
    }

    private static void adopt(ProvisioningRequest r, String adopted, ClusterLookup lookup) {
        if (adopted != null && !adopted.equals(r.getCanonicalName())) {
            LOG.info("Request " + r.getId() + " now tracks cluster as " + adopted);
            r.setCanonicalName(adopted);
        }
        if (lookup.getResourceId() != null) {
            r.setProviderResourceId(lookup.getResourceId());
        }
        r.setProviderState(lookup.getProviderState());
    }

    // the provider answered a status query with an error; the message is kept as the provider sent it
    public void onHardError(String id, ProviderException e) {
        long now = clock.millis();
        ProvisioningRequest failed = registry.update(id, r -> {
            if (!r.getState().isProvisioning() || r.isCancelled()) {
                return false;
            }
            estimator.fail(r);
            r.transition(RequestState.FAILED, now);
            r.setLastStatusMessage("Error checking cluster status: " + e.getDetail());
            return true;
        });
        if (failed != null) {
            stopTimers(id);
            LOG.error("Request " + id + " failed: " + e.getDetail(), e);
        }
    }

    /**
     * Fail the request if it has been provisioning for longer than the configured maximum.
     *
     * @return true if the request was failed by this call
     */
    public boolean enforceDeadline(String id) {
        long now = clock.millis();
        long max = config.getMaxProvisioningMillis();
        ProvisioningRequest failed = registry.update(id, r -> {
            if (!r.getState().isProvisioning() || r.isCancelled() || now - r.getStartedAt() <= max) {
                return false;
            }
            estimator.fail(r);
            r.transition(RequestState.FAILED, now);
            r.setLastStatusMessage("Cluster creation timed out after " + describeDuration(max));
            return true;
        });
        if (failed != null) {
            stopTimers(id);
            LOG.error("Request " + id + " timed out after " + describeDuration(max));
            return true;
        }
        return false;
    }

    public int enforceDeadlines() {
        int n = 0;
        for (ProvisioningRequest r : registry.list()) {
            if (r.getState().isProvisioning() && enforceDeadline(r.getId())) {
                n++;
            }
        }
        return n;
    }

    /**
     * User abort. Does nothing for a request that is already terminal or already being cancelled.
     *
     * @return true if this call started the cancellation
     */
    public boolean cancel(String id, String reason) throws UnknownRequestException {
        if (!registry.contains(id)) {
            throw new UnknownRequestException(id);
        }
        long now = clock.millis();
        ProvisioningRequest cancelled = registry.update(id, r -> {
            if (r.isTerminal() || r.isCancelled() || r.getState() == RequestState.DELETING) {
                return false;
            }
            r.setCancelled(true);
            r.setCancelReason(reason);
            r.transition(RequestState.DELETING, now);
            r.setDeleteRequestedAt(now);
            r.setDeleteIssued(false);
            r.setLastStatusMessage("Cancelling cluster creation...");
            return true;
        });
        if (cancelled == null) {
            LOG.info("Cancel of " + id + " ignored, request is already finished or cancelling");
            return false;
        }
        stopTimers(id);
        LOG.info("Cancelling " + id + (reason != null ? " (" + reason + ")" : ""));
        cancellation.begin(cancelled);
        return true;
    }

    /**
     * Bring persisted requests back after a restart: resume what is recent, fail what is stale,
     * and close out post-ready features that never recorded an outcome.
     */
    public void recover() {
        long now = clock.millis();
        long window = config.getRecoveryRetentionMillis();
        int resumed = 0, expired = 0, deleting = 0;
        for (ProvisioningRequest r : registry.list()) {
            String id = r.getId();
            switch (r.getState()) {
                case INITIALIZING:
                case CREATING:
                    if (now - r.getStartedAt() > window) {
                        registry.update(id, x -> {
                            estimator.fail(x);
                            x.transition(RequestState.FAILED, now);
                            x.setLastStatusMessage("Cluster creation timed out (older than " + describeDuration(window) + ")");
                            return true;
                        });
                        expired++;
                    } else {
                        // ticks are no-ops until a poll moves an INITIALIZING request to CREATING
                        scheduler.start(TimerKind.PROGRESS, id, config.getProgressTickMillis(), config.getProgressTickMillis(),
                                ProgressTickJob.class, this);
                        poller.start(id, config.getPollIntervalMillis());
                        resumed++;
                    }
                    break;
                case DELETING:
                    if (cancellation.resume(r)) {
                        deleting++;
                    }
                    break;
                case READY:
                    if (r.getFeature().isPending()) {
                        registry.update(id, x -> {
                            x.getFeature().setFailed(true);
                            x.getFeature().setCompletedAt(now);
                            x.getFeature().setMessage(feature.name() + " outcome unknown after restart");
                            return true;
                        });
                    }
                    break;
                default:
                    break;
            }
        }
        LOG.info("Recovery: " + resumed + " requests resumed, " + expired + " timed out, " + deleting + " deletions resumed");
    }

    void runFeature(ProvisioningRequest ready) {
        String id = ready.getId();
        String name = ready.getQueryName();
        String resourceId = ready.getProviderResourceId();
        long timeout = config.getFeatureTimeoutMillis();
        LOG.info("Enabling " + feature.name() + " for " + name);
        CompletableFuture<Void> done = CompletableFuture
                .supplyAsync(() -> {
                    try {
                        return feature.enable(name, resourceId);
                    } catch (ProviderException e) {
                        throw new CompletionException(e);
                    }
                }, io)
                .orTimeout(timeout, TimeUnit.MILLISECONDS)
                .handle((outcome, err) -> {
                    recordFeatureOutcome(id, outcome, err, timeout);
                    return null;
                });
        featuresInFlight.add(done);
        done.whenComplete((v, t) -> featuresInFlight.remove(done));
    }

    private void recordFeatureOutcome(String id, FeatureOutcome outcome, Throwable err, long timeout) {
        long now = clock.millis();
        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
        String message;
        if (cause instanceof TimeoutException) {
            message = "Failed to enable " + feature.name() + ": timed out after " + describeDuration(timeout);
        } else if (cause instanceof ProviderException) {
            message = "Failed to enable " + feature.name() + ": " + ((ProviderException) cause).getDetail();
        } else if (cause != null) {
            message = "Failed to enable " + feature.name() + ": " + cause.getMessage();
        } else {
            message = outcome.getMessage();
        }
        if (cause != null) {
            LOG.error("Post-ready " + feature.name() + " failed for " + id, cause);
        } else {
            LOG.info("Post-ready " + feature.name() + " for " + id + ": " + message);
        }
        ProvisioningRequest updated = registry.update(id, r -> {
            if (r.getFeature().getCompletedAt() != null) {
                return false;
            }
            r.getFeature().setEnabled(cause == null && outcome.isEnabled());
            r.getFeature().setFailed(cause != null);
            r.getFeature().setMessage(message);
            r.getFeature().setCompletedAt(now);
            return true;
        });
        if (updated == null && !registry.contains(id)) {
            LOG.warn("Request " + id + " was removed before its " + feature.name() + " outcome was recorded");
        }
    }

    // wait for post-ready features still running, used on shutdown
    public void awaitFeatures(long timeoutMillis) {
        List<CompletableFuture<Void>> pending = List.copyOf(featuresInFlight);
        if (pending.isEmpty()) {
            return;
        }
        LOG.info("Waiting for " + pending.size() + " post-ready tasks");
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn(pending.size() + " post-ready tasks still running at shutdown");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            LOG.error("Post-ready task failed during shutdown", e);
        }
    }

    public int featuresInFlight() {
        return featuresInFlight.size();
    }

    private void stopTimers(String id) {
        scheduler.stop(TimerKind.PROGRESS, id);
        if (poller != null) {
            poller.stop(id);
        }
    }

    static String describeDuration(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        }
        if (millis % 3600000L == 0) {
            long h = millis / 3600000L;
            return h + (h == 1 ? " hour" : " hours");
        }
        if (millis % 60000L == 0) {
            long m = millis / 60000L;
            return m + (m == 1 ? " minute" : " minutes");
        }
        return (millis / 1000) + "s";
    }
}
