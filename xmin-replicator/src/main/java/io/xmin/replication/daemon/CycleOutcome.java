package io.xmin.replication.daemon;

import java.time.Duration;

public class CycleOutcome {
    private static final CycleOutcome CATCH_UP = new CycleOutcome(Duration.ZERO, false);
    private static final CycleOutcome EXCLUDED = new CycleOutcome(Duration.ZERO, true);

    private final Duration delay;
    private final boolean excluded;

    private CycleOutcome(Duration delay, boolean excluded) {
        this.delay = delay;
        this.excluded = excluded;
    }

    public static CycleOutcome catchUp() {
        return CycleOutcome.CATCH_UP;
    }

    public static CycleOutcome sleep(Duration delay) {
        return new CycleOutcome(delay, false);
    }

    public static CycleOutcome excluded() {
        return CycleOutcome.EXCLUDED;
    }

    public Duration getDelay() {
        return this.delay;
    }

    public boolean isCatchUp() {
        return !this.excluded && this.delay.isZero();
    }

    public boolean isExcluded() {
        return this.excluded;
    }

    @Override
    public String toString() {
        if (this.excluded) {
            return "excluded";
        }

        return this.isCatchUp() ? "catch-up" : String.format("sleep %d ms", this.delay.toMillis());
    }
}
