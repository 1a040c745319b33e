package com.clusterops.orchestrator;

import com.clusterops.provider.ObservedState;
import com.clusterops.provider.ProviderErrorException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Runs the wired orchestrator on a real scheduler against an in-memory provider, with every
 * interval shrunk to milliseconds.
 */
class ProvisioningServiceTest {
    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path dir;

    private FakeClusterProvider provider;
    private RecordingFeature feature;
    private final List<ProvisioningService> services = new ArrayList<>();

    @BeforeEach
    void setUp() {
        provider = new FakeClusterProvider();
        feature = new RecordingFeature();
    }

    @AfterEach
    void tearDown() {
        for (ProvisioningService service : services) {
            service.shutdown();
        }
    }

    private OrchestratorConfig config() {
        Properties p = new Properties();
        p.setProperty("persistence.file", dir.resolve("cluster-requests.json").toString());
        p.setProperty("progress.tickMillis", "20");
        p.setProperty("progress.nominalDurationMillis", "5000");
        p.setProperty("poll.graceMillis", "50");
        p.setProperty("poll.intervalMillis", "50");
        p.setProperty("deletion.pollIntervalMillis", "50");
        p.setProperty("feature.timeoutMillis", "2000");
        p.setProperty("scheduler.threadCount", "4");
        p.setProperty("io.threadCount", "2");
        return new OrchestratorConfig(p);
    }

    private ProvisioningService startService() throws Exception {
        ProvisioningService service = new ProvisioningService(config(), provider, feature);
        services.add(service);
        service.start();
        return service;
    }

    private static RequestState stateOf(ProvisioningService service, String id) throws Exception {
        return service.status(id).getState();
    }

    @Test
    void createRunsThroughToReadyAndEnablesFeatureOnce() throws Exception {
        ProvisioningService service = startService();

        String id = service.create("app-1", "SMALL");
        assertThat(id).startsWith("req-");

        await().atMost(WAIT).until(() -> stateOf(service, id) == RequestState.CREATING);
        await().atMost(WAIT).until(() -> service.status(id).getProgressPercent() >= ProgressEstimator.VISIBLE);
        assertThat(service.status(id).getProgressPercent()).isLessThan(100);

        provider.set("app-1", ObservedState.READY);

        await().atMost(WAIT).until(() -> stateOf(service, id) == RequestState.READY);
        RequestStatus status = service.status(id);
        assertThat(status.getProgressPercent()).isEqualTo(100);
        assertThat(status.getConnectionDescriptor()).isEqualTo("fake://app-1");
        assertThat(status.getStatusMessage()).isEqualTo("Cluster app-1 is ready");
        assertThat(status.isFeatureTriggered()).isTrue();

        await().atMost(WAIT).until(() -> service.status(id).isFeatureEnabled());
        await().during(Duration.ofMillis(300)).atMost(WAIT).until(() -> feature.calls.get() == 1);
        assertThat(service.getScheduler().isActive(TimerKind.RECONCILE, id)).isFalse();
        assertThat(service.getScheduler().isActive(TimerKind.PROGRESS, id)).isFalse();
        assertThat(provider.creates.get()).isEqualTo(1);
    }

    @Test
    void providerReportedFailureFailsRequest() throws Exception {
        ProvisioningService service = startService();
        String id = service.create("app-1", "MEDIUM");
        await().atMost(WAIT).until(() -> stateOf(service, id) == RequestState.CREATING);

        provider.set("app-1", ObservedState.FAILED);

        await().atMost(WAIT).until(() -> stateOf(service, id) == RequestState.FAILED);
        assertThat(service.status(id).getProgressPercent()).isZero();
        assertThat(feature.calls.get()).isZero();
    }

    @Test
    void rejectedCreateCallFailsRequestAndReleasesName() throws Exception {
        provider.failCreateWith = new ProviderErrorException("INVALID_ATTRIBUTE", "Invalid attribute name specified.");
        ProvisioningService service = startService();

        String id = service.create("app-1", "SMALL");

        await().atMost(WAIT).until(() -> stateOf(service, id) == RequestState.FAILED);
        assertThat(service.status(id).getStatusMessage())
                .isEqualTo("Failed to create cluster: Invalid attribute name specified.");

        provider.failCreateWith = null;
        assertThat(service.create("app-1", "SMALL")).isNotEqualTo(id);
    }

    @Test
    void duplicateAndInvalidCreatesAreRejected() throws Exception {
        ProvisioningService service = startService();
        String id = service.create("app-1", "SMALL");

        assertThatThrownBy(() -> service.create("app-1", "LARGE"))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining(id);
        assertThatThrownBy(() -> service.create("bad_name", "SMALL")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.create("app-2", "HUGE")).isInstanceOf(ValidationException.class);
        assertThat(service.list()).hasSize(1);
    }

    @Test
    void cancelDeletesClusterAndForgetsRequest() throws Exception {
        ProvisioningService service = startService();
        String id = service.create("app-1", "SMALL");
        await().atMost(WAIT).until(() -> stateOf(service, id) == RequestState.CREATING);

        assertThat(service.cancel(id, "changed my mind")).isTrue();
        RequestStatus status = service.status(id);
        assertThat(status.getState()).isEqualTo(RequestState.DELETING);
        assertThat(status.isCancelled()).isTrue();

        await().atMost(WAIT).until(() -> !service.getRegistry().contains(id));
        assertThat(provider.clusters).isEmpty();
        assertThat(feature.calls.get()).isZero();
        assertThatThrownBy(() -> service.status(id)).isInstanceOf(UnknownRequestException.class);
    }

    @Test
    void cancelOfFinishedRequestChangesNothing() throws Exception {
        ProvisioningService service = startService();
        String id = service.create("app-1", "SMALL");
        await().atMost(WAIT).until(() -> stateOf(service, id) == RequestState.CREATING);
        provider.set("app-1", ObservedState.READY);
        await().atMost(WAIT).until(() -> stateOf(service, id) == RequestState.READY);

        assertThat(service.cancel(id, null)).isTrue();

        assertThat(stateOf(service, id)).isEqualTo(RequestState.READY);
        assertThat(service.status(id).isCancelled()).isFalse();
        assertThat(provider.clusters).containsKey("app-1");
        assertThatThrownBy(() -> service.cancel("req-nope", null)).isInstanceOf(UnknownRequestException.class);
    }

    @Test
    void restartResumesInFlightRequests() throws Exception {
        ProvisioningService first = startService();
        String id = first.create("app-1", "SMALL");
        await().atMost(WAIT).until(() -> stateOf(first, id) == RequestState.CREATING);
        first.shutdown();
        services.remove(first);

        ProvisioningService second = startService();
        assertThat(stateOf(second, id)).isEqualTo(RequestState.CREATING);
        assertThat(second.getScheduler().isActive(TimerKind.RECONCILE, id)).isTrue();

        provider.set("app-1", ObservedState.READY);

        await().atMost(WAIT).until(() -> stateOf(second, id) == RequestState.READY);
        await().atMost(WAIT).until(() -> second.status(id).isFeatureEnabled());
        assertThat(provider.creates.get()).isEqualTo(1);
    }

    @Test
    void clearAllForgetsEverything() throws Exception {
        ProvisioningService service = startService();
        service.create("app-1", "SMALL");
        service.create("app-2", "LARGE");

        assertThat(service.clearAll()).isEqualTo(2);

        assertThat(service.list()).isEmpty();
        assertThat(dir.resolve("cluster-requests.json")).doesNotExist();
    }

    @Test
    void listReturnsRequestsInCreationOrder() throws Exception {
        ProvisioningService service = startService();
        String a = service.create("app-a", "SMALL");
        String b = service.create("app-b", "SMALL");

        assertThat(service.list()).extracting(RequestStatus::getId).containsExactly(a, b);
    }
}
