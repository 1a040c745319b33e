package com.clusterops.orchestrator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyed store of provisioning requests, written through to a JSON snapshot on every change.
 *
 * <p>All access goes through the registry lock. Callers never hold a live record: {@link #find}
 * and {@link #list} return copies, and changes are made with {@link #update}, which runs the
 * mutation and the snapshot write as one step.
 */
public class RequestRegistry {
    final static Logger LOG = LogManager.getLogger(RequestRegistry.class);

    /** Change a record in place; return false to leave it (and the snapshot) untouched. */
    public interface RecordMutation {
        boolean apply(ProvisioningRequest record);
    }

    private static final TypeReference<List<ProvisioningRequest>> SNAPSHOT_TYPE = new TypeReference<List<ProvisioningRequest>>() { };

    private final Map<String, ProvisioningRequest> requests = new LinkedHashMap<>();
    private final Path snapshot;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    // snapshot may be null for a purely in-memory registry
    public RequestRegistry(Path snapshot) {
        this.snapshot = snapshot;
    }

    /**
     * Insert a new record unless an active request already holds its desired name.
     */
    public synchronized void insertIfNameAvailable(ProvisioningRequest record) throws ConflictException {
        String name = record.getDesiredName();
        for (ProvisioningRequest existing : requests.values()) {
            if (existing.holdsName(name)) {
                throw new ConflictException(name, existing.getId());
            }
        }
        requests.put(record.getId(), new ProvisioningRequest(record));
        persist();
    }

    public synchronized ProvisioningRequest find(String id) {
        ProvisioningRequest r = requests.get(id);
        return r == null ? null : new ProvisioningRequest(r);
    }

    public synchronized boolean contains(String id) {
        return requests.containsKey(id);
    }

    /**
     * Apply {@code mutation} to the record with this id under the registry lock.
     *
     * @return a copy of the record after the change, or null if the record is gone or the
     *         mutation declined to change it
     */
    public synchronized ProvisioningRequest update(String id, RecordMutation mutation) {
        ProvisioningRequest r = requests.get(id);
        if (r == null) {
            return null;
        }
        if (!mutation.apply(r)) {
            return null;
        }
        persist();
        return new ProvisioningRequest(r);
    }

    public synchronized ProvisioningRequest remove(String id) {
        ProvisioningRequest r = requests.remove(id);
        if (r != null) {
            persist();
        }
        return r;
    }

    // oldest first
    public synchronized List<ProvisioningRequest> list() {
        List<ProvisioningRequest> copies = new ArrayList<>();
        for (ProvisioningRequest r : requests.values()) {
            copies.add(new ProvisioningRequest(r));
        }
        copies.sort(Comparator.comparingLong(ProvisioningRequest::getStartedAt).thenComparing(ProvisioningRequest::getId));
        return copies;
    }

    public synchronized int size() {
        return requests.size();
    }

    public synchronized Map<RequestState, Integer> summary() {
        Map<RequestState, Integer> counts = new EnumMap<>(RequestState.class);
        for (ProvisioningRequest r : requests.values()) {
            counts.merge(r.getState(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Replace the in-memory contents with the snapshot file. A missing file means a fresh start;
     * an unreadable one is logged and left on disk for inspection.
     *
     * @return number of records loaded
     */
    public synchronized int load() {
        requests.clear();
        if (snapshot == null || !Files.exists(snapshot)) {
            LOG.info("No persisted requests found, starting fresh");
            return 0;
        }
        try {
            List<ProvisioningRequest> loaded = mapper.readValue(snapshot.toFile(), SNAPSHOT_TYPE);
            for (ProvisioningRequest r : loaded) {
                if (r == null || r.getId() == null || r.getState() == null) {
                    LOG.warn("Skipping incomplete persisted record: " + r);
                    continue;
                }
                requests.put(r.getId(), r);
            }
            LOG.info("Loaded " + requests.size() + " requests from " + snapshot);
        } catch (IOException e) {
            LOG.error("Could not read request snapshot " + snapshot + ", starting with an empty registry", e);
            requests.clear();
        }
        return requests.size();
    }

    /**
     * Drop terminal records past their retention: FAILED after {@code failedRetentionMillis},
     * READY after {@code readyRetentionMillis}, both measured from the terminal transition.
     *
     * @return the removed records
     */
    public synchronized List<ProvisioningRequest> sweep(long now, long failedRetentionMillis, long readyRetentionMillis) {
        List<ProvisioningRequest> removed = new ArrayList<>();
        for (ProvisioningRequest r : new ArrayList<>(requests.values())) {
            long finished = r.getFinishedAt() != null ? r.getFinishedAt() : r.getUpdatedAt();
            long age = now - finished;
            boolean expired = (r.getState() == RequestState.FAILED && age > failedRetentionMillis)
                    || (r.getState() == RequestState.READY && age > readyRetentionMillis)
                    || r.getState() == RequestState.DELETED;
            if (expired) {
                requests.remove(r.getId());
                removed.add(r);
            }
        }
        if (!removed.isEmpty()) {
            persist();
        }
        return removed;
    }

    // empty the registry and delete the snapshot file
    public synchronized int clear() {
        int n = requests.size();
        requests.clear();
        if (snapshot != null) {
            try {
                Files.deleteIfExists(snapshot);
            } catch (IOException e) {
                LOG.error("Could not delete request snapshot " + snapshot, e);
            }
        }
        return n;
    }

    // write the whole registry; a failed write is logged and memory stays authoritative
    synchronized void persist() {
        if (snapshot == null) {
            return;
        }
        List<ProvisioningRequest> all = new ArrayList<>(requests.values());
        all.sort(Comparator.comparingLong(ProvisioningRequest::getStartedAt).thenComparing(ProvisioningRequest::getId));
        try {
            byte[] json = mapper.writeValueAsBytes(all);
            Path dir = snapshot.toAbsolutePath().getParent();
            Path tmp = Files.createTempFile(dir, snapshot.getFileName().toString(), ".tmp");
            Files.write(tmp, json);
            try {
                Files.move(tmp, snapshot, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, snapshot, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Saved " + all.size() + " requests to " + snapshot);
        } catch (JsonProcessingException e) {
            LOG.error("Could not serialize requests", e);
        } catch (IOException e) {
            LOG.error("Could not write request snapshot " + snapshot, e);
        }
    }
}
