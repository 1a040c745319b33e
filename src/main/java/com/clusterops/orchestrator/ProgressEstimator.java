package com.clusterops.orchestrator;

/**
 * Completion percentage for a creating cluster. The provider reports no real progress, so the
 * value is driven by elapsed time against a nominal duration and pushed up by whatever milestones
 * the provider does reveal.
 *
 * <ul>
 *   <li>time phase: {@code min(cap, elapsed / nominal * cap)}</li>
 *   <li>confirmation phase (past the nominal duration, still creating): +1 per poll, up to 99</li>
 *   <li>milestones raise a floor the estimate never drops below</li>
 *   <li>100 only on confirmed ready, 0 on failure</li>
 * </ul>
 *
 * Methods change the record handed in and report whether the percentage moved; they are meant to
 * run inside {@link RequestRegistry#update}.
 */
public class ProgressEstimator {
    public static final int ACCEPTED = 10;
    public static final int VISIBLE = 20;
    public static final int CONFIRMATION_MAX = 99;

    private final long nominalDurationMillis;
    private final int cap;

    public ProgressEstimator(long nominalDurationMillis, int cap) {
        if (nominalDurationMillis <= 0) {
            throw new IllegalArgumentException("nominal duration must be positive");
        }
        if (cap < 0 || cap > CONFIRMATION_MAX) {
            throw new IllegalArgumentException("cap must be within 0.." + CONFIRMATION_MAX);
        }
        this.nominalDurationMillis = nominalDurationMillis;
        this.cap = cap;
    }

    public int timeBased(long elapsedMillis) {
        if (elapsedMillis <= 0) {
            return 0;
        }
        if (elapsedMillis >= nominalDurationMillis) {
            return cap;
        }
        return (int) Math.min(cap, (elapsedMillis * cap) / nominalDurationMillis);
    }

    // periodic tick: time phase only; the record is left alone unless the percentage moves
    public boolean tick(ProvisioningRequest r, long now) {
        if (r.getState() != RequestState.CREATING) {
            return false;
        }
        long elapsed = now - r.getStartedAt();
        int before = r.getProgressPercent();
        int next = Math.max(before, Math.max(r.getProgressFloor(), timeBased(elapsed)));
        if (next == before) {
            return false;
        }
        r.setProgressPercent(next);
        r.setLastStatusMessage(describe(next, elapsed / 1000));
        return true;
    }

    /**
     * A poll saw the cluster still provisioning. {@code providerPercent} is the provider's own
     * figure when it has one.
     */
    public boolean onPoll(ProvisioningRequest r, long now, Integer providerPercent) {
        if (r.getState() != RequestState.CREATING) {
            return false;
        }
        int before = r.getProgressPercent();
        raiseFloor(r, VISIBLE);
        if (providerPercent != null) {
            raiseFloor(r, providerPercent);
        }
        long elapsed = now - r.getStartedAt();
        int next = Math.max(r.getProgressPercent(), timeBased(elapsed));
        if (elapsed >= nominalDurationMillis) {
            next = Math.max(next, Math.min(CONFIRMATION_MAX, before + 1));
        }
        r.setProgressPercent(next);
        return next != before;
    }

    // milestone from the provider; never above 99, never lowers anything
    public void raiseFloor(ProvisioningRequest r, int milestone) {
        int floor = Math.max(r.getProgressFloor(), Math.min(CONFIRMATION_MAX, Math.max(0, milestone)));
        r.setProgressFloor(floor);
        if (r.getProgressPercent() < floor) {
            r.setProgressPercent(floor);
        }
    }

    public void complete(ProvisioningRequest r) {
        r.setProgressPercent(100);
    }

    public void fail(ProvisioningRequest r) {
        r.setProgressPercent(0);
        r.setProgressFloor(0);
    }

    public static String describe(int percent, long elapsedSeconds) {
        String phase;
        if (percent < 25) {
            phase = "Initializing cluster configuration...";
        } else if (percent < 40) {
            phase = "Provisioning cloud infrastructure...";
        } else if (percent < 55) {
            phase = "Setting up database instances...";
        } else if (percent < 70) {
            phase = "Configuring replication and security...";
        } else if (percent < 85) {
            phase = "Finalizing cluster setup...";
        } else {
            phase = "Almost complete...";
        }
        return phase + " (" + elapsedSeconds + "s)";
    }
}
