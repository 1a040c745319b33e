package com.clusterops.orchestrator;

import com.clusterops.provider.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressEstimatorTest {
    private static final long NOMINAL = 480_000L;
    private static final long START = 1_000_000L;

    private ProgressEstimator estimator;
    private ProvisioningRequest request;

    @BeforeEach
    void setUp() {
        estimator = new ProgressEstimator(NOMINAL, 95);
        request = new ProvisioningRequest("req-1", "app-1", Tier.SMALL, "US_EAST_1", START);
        request.transition(RequestState.CREATING, START);
    }

    @Test
    void timePhaseIsLinearAndCapped() {
        assertThat(estimator.timeBased(0)).isZero();
        assertThat(estimator.timeBased(NOMINAL / 2)).isEqualTo(47);
        assertThat(estimator.timeBased(NOMINAL - 1)).isLessThanOrEqualTo(95);
        assertThat(estimator.timeBased(NOMINAL)).isEqualTo(95);
        assertThat(estimator.timeBased(NOMINAL * 10)).isEqualTo(95);
    }

    @Test
    void timePhaseNeverExceedsCapBeforeNominalDuration() {
        for (long t = 0; t < NOMINAL; t += 997) {
            assertThat(estimator.timeBased(t)).isBetween(0, 95);
        }
    }

    @Test
    void tickIsMonotonicAndFollowsElapsedTime() {
        int last = 0;
        for (long t = 0; t <= NOMINAL + 60_000; t += 10_000) {
            estimator.tick(request, START + t);
            assertThat(request.getProgressPercent()).isGreaterThanOrEqualTo(last);
            last = request.getProgressPercent();
        }
        assertThat(last).isEqualTo(95);
        assertThat(request.getLastStatusMessage()).startsWith("Almost complete...");
    }

    @Test
    void tickReportsWhetherThePercentageMoved() {
        assertThat(estimator.tick(request, START + 60_000)).isTrue();
        assertThat(estimator.tick(request, START + 60_001)).isFalse();
    }

    @Test
    void tickThatDoesNotMoveLeavesTheMessageAlone() {
        estimator.tick(request, START + 60_000);
        String shown = request.getLastStatusMessage();

        assertThat(estimator.tick(request, START + 60_500)).isFalse();
        assertThat(request.getLastStatusMessage()).isEqualTo(shown);
    }

    @Test
    void tickIgnoresRequestsThatAreNotCreating() {
        request.transition(RequestState.READY, START);
        request.setProgressPercent(100);

        assertThat(estimator.tick(request, START + NOMINAL)).isFalse();
        assertThat(request.getProgressPercent()).isEqualTo(100);
    }

    @Test
    void floorHoldsEstimateUp() {
        estimator.raiseFloor(request, ProgressEstimator.ACCEPTED);
        estimator.tick(request, START + 1_000);
        assertThat(request.getProgressPercent()).isEqualTo(10);

        estimator.onPoll(request, START + 2_000, null);
        assertThat(request.getProgressPercent()).isEqualTo(ProgressEstimator.VISIBLE);
        assertThat(request.getProgressFloor()).isEqualTo(ProgressEstimator.VISIBLE);
    }

    @Test
    void providerPercentRaisesFloorButNeverReaches100() {
        estimator.onPoll(request, START + 1_000, 60);
        assertThat(request.getProgressPercent()).isEqualTo(60);

        estimator.onPoll(request, START + 2_000, 100);
        assertThat(request.getProgressPercent()).isEqualTo(99);
    }

    @Test
    void lowerProviderPercentDoesNotLowerEstimate() {
        estimator.onPoll(request, START + 1_000, 60);
        estimator.onPoll(request, START + 2_000, 30);

        assertThat(request.getProgressPercent()).isEqualTo(60);
    }

    @Test
    void confirmationPhaseCreepsOnePerPollUpTo99() {
        estimator.tick(request, START + NOMINAL);
        assertThat(request.getProgressPercent()).isEqualTo(95);

        estimator.onPoll(request, START + NOMINAL + 10_000, null);
        assertThat(request.getProgressPercent()).isEqualTo(96);
        for (int i = 0; i < 10; i++) {
            estimator.onPoll(request, START + NOMINAL + 20_000 + i, null);
        }
        assertThat(request.getProgressPercent()).isEqualTo(99);
    }

    @Test
    void pollBeforeNominalDurationDoesNotCreep() {
        estimator.tick(request, START + NOMINAL / 2);
        int before = request.getProgressPercent();

        estimator.onPoll(request, START + NOMINAL / 2, null);

        assertThat(request.getProgressPercent()).isEqualTo(before);
    }

    @Test
    void terminalOverrides() {
        estimator.onPoll(request, START + 1_000, 50);
        estimator.complete(request);
        assertThat(request.getProgressPercent()).isEqualTo(100);

        estimator.fail(request);
        assertThat(request.getProgressPercent()).isZero();
        assertThat(request.getProgressFloor()).isZero();
    }

    @Test
    void phaseMessagesFollowPercentage() {
        assertThat(ProgressEstimator.describe(10, 5)).isEqualTo("Initializing cluster configuration... (5s)");
        assertThat(ProgressEstimator.describe(30, 5)).startsWith("Provisioning cloud infrastructure");
        assertThat(ProgressEstimator.describe(50, 5)).startsWith("Setting up database instances");
        assertThat(ProgressEstimator.describe(60, 5)).startsWith("Configuring replication and security");
        assertThat(ProgressEstimator.describe(80, 5)).startsWith("Finalizing cluster setup");
        assertThat(ProgressEstimator.describe(95, 5)).startsWith("Almost complete");
    }

    @Test
    void rejectsNonsenseConfiguration() {
        assertThatThrownBy(() -> new ProgressEstimator(0, 95)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProgressEstimator(NOMINAL, 100)).isInstanceOf(IllegalArgumentException.class);
    }
}
