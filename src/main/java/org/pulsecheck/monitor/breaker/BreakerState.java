package org.pulsecheck.monitor.breaker;

/**
 * State of a per-component circuit breaker.
 */
public enum BreakerState {
    /** The probe runs normally. */
    CLOSED,
    /** The probe is skipped until the cooldown has elapsed since the last failure. */
    OPEN
}
