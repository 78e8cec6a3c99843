package org.pulsecheck.monitor.api.report;

/**
 * Status of a single component or of the whole system.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    /** No information is available yet (e.g. no check cycle has run). */
    UNKNOWN,
    /** The probe was skipped because its circuit breaker is open. Only valid for one cycle. */
    CIRCUIT_OPEN;

    /**
     * Whether this status should be counted as a hard failure when summarising.
     * A skipped probe is treated like a failed one.
     */
    public boolean isUnhealthyEquivalent() {
        return this == UNHEALTHY || this == CIRCUIT_OPEN;
    }
}
