package com.clusterops.orchestrator;

import com.clusterops.provider.ClusterLookup;
import com.clusterops.provider.ClusterProvider;
import com.clusterops.provider.ObservedState;
import com.clusterops.provider.ProviderErrorException;
import com.clusterops.provider.ProviderTransportException;
import com.clusterops.provider.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationPollerTest {
    @Mock
    private ClusterProvider provider;
    @Mock
    private LifecycleController controller;
    @Mock
    private JobScheduler scheduler;

    private RequestRegistry registry;
    private ReconciliationPoller poller;

    @BeforeEach
    void setUp() throws Exception {
        lenient().when(provider.name()).thenReturn("Atlas");
        registry = new RequestRegistry(null);
        poller = new ReconciliationPoller(registry, provider, new NameResolver(), controller, scheduler, 10_000L);
        ProvisioningRequest r = new ProvisioningRequest("req-1", "app-1", Tier.SMALL, "US_EAST_1", 0);
        r.transition(RequestState.CREATING, 0);
        registry.insertIfNameAvailable(r);
    }

    @Test
    void startSchedulesAfterGraceDelay() {
        poller.start("req-1", 30_000L);

        verify(scheduler).start(TimerKind.RECONCILE, "req-1", 30_000L, 10_000L, ReconcilePollJob.class, poller);
    }

    @Test
    void notFoundYetChangesNothing() throws Exception {
        when(provider.get("app-1")).thenReturn(ClusterLookup.notFound());

        poller.pollOnce("req-1");

        verify(controller, never()).onReconcile(anyString(), any());
        verify(controller, never()).onHardError(anyString(), any());
        assertThat(registry.find("req-1").getState()).isEqualTo(RequestState.CREATING);
    }

    @Test
    void foundClusterIsReportedToController() throws Exception {
        when(provider.get("app-1")).thenReturn(ClusterLookup.found("app-1", "id", "IDLE", ObservedState.READY, "uri", null));

        poller.pollOnce("req-1");

        ArgumentCaptor<NameResolver.Resolution> captor = ArgumentCaptor.forClass(NameResolver.Resolution.class);
        verify(controller).onReconcile(eq("req-1"), captor.capture());
        assertThat(captor.getValue().getLookup().getState()).isEqualTo(ObservedState.READY);
        assertThat(captor.getValue().getAdoptedName()).isEqualTo("app-1");
    }

    @Test
    void transportErrorsAreRetriedNextTick() throws Exception {
        when(provider.get("app-1")).thenThrow(new ProviderTransportException("GET /clusters/app-1 returned HTTP 503"));

        poller.pollOnce("req-1");

        verify(controller, never()).onHardError(anyString(), any());
        verify(scheduler, never()).stop(TimerKind.RECONCILE, "req-1");
    }

    @Test
    void hardErrorsGoToController() throws Exception {
        ProviderErrorException error = ProviderErrorException.malformed("Unexpected response format", null);
        when(provider.get("app-1")).thenThrow(error);

        poller.pollOnce("req-1");

        verify(controller).onHardError("req-1", error);
    }

    @Test
    void fallbackLookupAdoptsRequestedName() throws Exception {
        registry.update("req-1", r -> {
            r.setCanonicalName("App-1-guessed");
            return true;
        });
        when(provider.get("App-1-guessed")).thenReturn(ClusterLookup.notFound());
        when(provider.get("app-1")).thenReturn(ClusterLookup.found(null, "id", "CREATING", ObservedState.PROVISIONING, null, null));

        poller.pollOnce("req-1");

        ArgumentCaptor<NameResolver.Resolution> captor = ArgumentCaptor.forClass(NameResolver.Resolution.class);
        verify(controller).onReconcile(eq("req-1"), captor.capture());
        assertThat(captor.getValue().getAdoptedName()).isEqualTo("app-1");
        assertThat(captor.getValue().isFallbackUsed()).isTrue();
    }

    @Test
    void deadlineCheckedBeforeQuerying() {
        when(controller.enforceDeadline("req-1")).thenReturn(true);

        poller.pollOnce("req-1");

        verifyNoInteractions(provider);
    }

    @Test
    void stopsItselfForFinishedOrCancelledRequests() {
        registry.update("req-1", r -> {
            r.setCancelled(true);
            r.transition(RequestState.DELETING, 1);
            return true;
        });

        poller.pollOnce("req-1");
        poller.pollOnce("req-gone");

        verify(scheduler).stop(TimerKind.RECONCILE, "req-1");
        verify(scheduler).stop(TimerKind.RECONCILE, "req-gone");
        verifyNoInteractions(provider);
    }
}
