package org.pulsecheck.monitor.breaker;

import java.time.Instant;

/**
 * Immutable snapshot of the failure history of one component.
 *
 * @param consecutiveFailures Failures since the last success.
 * @param lastFailureAt       When the last failure was recorded, {@code null} if never.
 * @param state               Breaker state as of the last update.
 */
public record FailureRecord(int consecutiveFailures, Instant lastFailureAt, BreakerState state) {

    public static final FailureRecord CLEAN = new FailureRecord(0, null, BreakerState.CLOSED);

    public FailureRecord {
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures must be >= 0, got: " + consecutiveFailures);
        }
    }

    FailureRecord withState(BreakerState newState) {
        return new FailureRecord(consecutiveFailures, lastFailureAt, newState);
    }
}
