package com.clusterops.orchestrator;

import com.clusterops.provider.ClusterLookup;
import com.clusterops.provider.ClusterProvider;
import com.clusterops.provider.DeleteOutcome;
import com.clusterops.provider.ProviderException;
import com.clusterops.provider.ProviderTransportException;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Tears down a cancelled request: issues deletes for every name the cluster may exist under, then
 * polls until the provider no longer knows any of them. Confirmed deletion removes the record;
 * a deletion that is not confirmed in time is left for an operator.
 */
public class CancellationCoordinator {
    final static Logger LOG = LogManager.getLogger(CancellationCoordinator.class);

    private final RequestRegistry registry;
    private final ClusterProvider provider;
    private final JobScheduler scheduler;
    private final Clock clock;
    private final Executor io;
    private final long pollIntervalMillis;
    private final long maxDurationMillis;
    // request id -> delete rounds queued on the I/O executor and not yet finished
    private final Map<String, Integer> queuedDeletes = new ConcurrentHashMap<>();

    public CancellationCoordinator(RequestRegistry registry, ClusterProvider provider, JobScheduler scheduler,
                                   Clock clock, Executor io, long pollIntervalMillis, long maxDurationMillis) {
        this.registry = registry;
        this.provider = provider;
        this.scheduler = scheduler;
        this.clock = clock;
        this.io = io;
        this.pollIntervalMillis = pollIntervalMillis;
        this.maxDurationMillis = maxDurationMillis;
    }

    // r is already DELETING with its estimator and poller stopped
    public void begin(ProvisioningRequest r) {
        String id = r.getId();
        queueDeletes(id);
        scheduler.start(TimerKind.DELETION, id, pollIntervalMillis, pollIntervalMillis, DeletionPollJob.class, this);
    }

    // every name the cluster may exist under, canonical first
    static List<String> namesOf(ProvisioningRequest r) {
        List<String> names = new ArrayList<>();
        if (r.getCanonicalName() != null) {
            names.add(r.getCanonicalName());
        }
        if (r.getDesiredName() != null && !names.contains(r.getDesiredName())) {
            names.add(r.getDesiredName());
        }
        return names;
    }

    // counted before the task is queued so a deletion tick never races the first round
    private void queueDeletes(String id) {
        queuedDeletes.merge(id, 1, Integer::sum);
        io.execute(() -> {
            try {
                issueDeletes(id);
            } finally {
                queuedDeletes.computeIfPresent(id, (k, n) -> n > 1 ? n - 1 : null);
            }
        });
    }

    boolean deletesQueued(String id) {
        return queuedDeletes.containsKey(id);
    }

    /**
     * Send a delete for each name. The request counts as issued once every delete was accepted or
     * answered with not-found.
     */
    public boolean issueDeletes(String id) {
        ProvisioningRequest r = registry.find(id);
        if (r == null || r.getState() != RequestState.DELETING) {
            return false;
        }
        boolean landed = true;
        String failure = null;
        for (String name : namesOf(r)) {
            try {
                DeleteOutcome outcome = provider.delete(name);
                LOG.info("Delete of " + name + " at " + provider.name() + ": " + outcome);
            } catch (ProviderException e) {
                LOG.error("Delete of " + name + " failed for " + id + ", will retry", e);
                landed = false;
                failure = e.getDetail();
            }
        }
        boolean issued = landed;
        String detail = failure;
        registry.update(id, x -> {
            if (x.getState() != RequestState.DELETING) {
                return false;
            }
            x.setDeleteIssued(issued);
            x.setUpdatedAt(clock.millis());
            x.setLastStatusMessage(issued ? "Deleting cluster..." : "Delete request failed, retrying: " + detail);
            return true;
        });
        return issued;
    }

    /**
     * One deletion-confirmation tick.
     */
    public void pollDeletion(String id) {
        ProvisioningRequest r = registry.find(id);
        if (r == null || r.getState() != RequestState.DELETING) {
            scheduler.stop(TimerKind.DELETION, id);
            return;
        }
        long now = clock.millis();
        long requested = r.getDeleteRequestedAt() != null ? r.getDeleteRequestedAt() : r.getUpdatedAt();
        if (now - requested > maxDurationMillis) {
            scheduler.stop(TimerKind.DELETION, id);
            String message = "Deletion not confirmed after " + LifecycleController.describeDuration(maxDurationMillis)
                    + ", manual cleanup of " + String.join("/", namesOf(r)) + " may be required";
            registry.update(id, x -> {
                x.setUpdatedAt(now);
                x.setLastStatusMessage(message);
                return true;
            });
            LOG.warn(id + ": " + message);
            return;
        }
        if (!r.isDeleteIssued()) {
            if (deletesQueued(id)) {
                LOG.debug("Delete for " + id + " still in flight, checking next tick");
                return;
            }
            if (!issueDeletes(id)) {
                return;
            }
        }
        String stillThere = null;
        try {
            for (String name : namesOf(r)) {
                ClusterLookup lookup = provider.get(name);
                if (lookup.isFound()) {
                    stillThere = name + " is " + lookup.getProviderState();
                    break;
                }
            }
        } catch (ProviderTransportException e) {
            LOG.warn("Deletion check for " + id + " did not complete, retrying next tick: " + e.getMessage());
            return;
        } catch (ProviderException e) {
            LOG.error("Deletion check for " + id + " failed", e);
            registry.update(id, x -> {
                x.setUpdatedAt(now);
                x.setLastStatusMessage("Error checking deletion: " + e.getDetail());
                return true;
            });
            return;
        }
        if (stillThere != null) {
            String message = "Deletion in progress at " + provider.name() + " (" + stillThere + ")";
            registry.update(id, x -> {
                x.setUpdatedAt(now);
                x.setLastStatusMessage(message);
                return true;
            });
            return;
        }
        confirmDeleted(id);
    }

    private void confirmDeleted(String id) {
        long now = clock.millis();
        ProvisioningRequest deleted = registry.update(id, x -> {
            if (x.getState() != RequestState.DELETING) {
                return false;
            }
            x.transition(RequestState.DELETED, now);
            x.setLastStatusMessage("Cluster deleted");
            return true;
        });
        scheduler.stop(TimerKind.DELETION, id);
        if (deleted != null) {
            registry.remove(id);
            LOG.info("Deletion of " + String.join("/", namesOf(deleted)) + " confirmed, request " + id + " removed");
        }
    }

    /**
     * Pick a DELETING record back up after a restart.
     *
     * @return false when it is past the deletion bound and left for an operator
     */
    public boolean resume(ProvisioningRequest r) {
        long now = clock.millis();
        Long requested = r.getDeleteRequestedAt();
        if (requested != null && now - requested > maxDurationMillis) {
            LOG.warn("Deletion of " + r.getId() + " was not confirmed before restart, leaving it for manual cleanup");
            return false;
        }
        if (requested == null) {
            registry.update(r.getId(), x -> {
                x.setDeleteRequestedAt(now);
                return true;
            });
        }
        if (!r.isDeleteIssued()) {
            queueDeletes(r.getId());
        }
        scheduler.start(TimerKind.DELETION, r.getId(), pollIntervalMillis, pollIntervalMillis, DeletionPollJob.class, this);
        return true;
    }

    // the create call came back after the user cancelled; delete again so the new cluster is not orphaned
    public void onLateAck(ProvisioningRequest r) {
        LOG.warn("Create of " + r.getQueryName() + " acknowledged after cancel, deleting again");
        registry.update(r.getId(), x -> {
            x.setDeleteIssued(false);
            return true;
        });
        queueDeletes(r.getId());
        if (!scheduler.isActive(TimerKind.DELETION, r.getId())) {
            scheduler.start(TimerKind.DELETION, r.getId(), pollIntervalMillis, pollIntervalMillis, DeletionPollJob.class, this);
        }
    }

    // the record is gone but the provider may have created the cluster anyway
    public void deleteOrphan(String name) {
        try {
            DeleteOutcome outcome = provider.delete(name);
            LOG.warn("Deleted untracked cluster " + name + ": " + outcome);
        } catch (ProviderException e) {
            LOG.error("Could not delete untracked cluster " + name + ", manual cleanup required", e);
        }
    }
}
