package org.pulsecheck.monitor.policy;

import org.pulsecheck.monitor.api.probes.ProbeOutcome;
import org.pulsecheck.monitor.api.report.ComponentResult;
import org.pulsecheck.monitor.api.report.HealthStatus;
import org.pulsecheck.monitor.api.report.Priority;
import org.pulsecheck.monitor.breaker.FailureRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a raw probe outcome and the component's priority into a {@link ComponentResult}.
 * <p>
 * <strong>Mapping:</strong>
 * <pre>
 * Priority   Outcome          Status                                  Contribution
 * CRITICAL   success          HEALTHY                                 1.0
 * CRITICAL   failure          UNHEALTHY                               0.0
 * IMPORTANT  success          HEALTHY                                 1.0
 * IMPORTANT  failure          DEGRADED                                0.5
 * OPTIONAL   success          HEALTHY                                 1.0
 * OPTIONAL   failure          HEALTHY (detail.optional_unavailable)   1.0
 * </pre>
 * A success hinted as DEGRADED yields DEGRADED / 0.5 for CRITICAL and IMPORTANT components and
 * HEALTHY with {@code detail.optional_degraded} for OPTIONAL ones. A probe skipped by an open
 * breaker is labelled CIRCUIT_OPEN and scored like a failure of its priority.
 */
public final class DegradationPolicy {

    public static final String OPTIONAL_UNAVAILABLE = "optional_unavailable";
    public static final String OPTIONAL_DEGRADED = "optional_degraded";

    /**
     * Assesses a probe that actually ran.
     *
     * @param name      The component name.
     * @param priority  The component priority for this cycle.
     * @param outcome   What the probe reported.
     * @param latencyMs Measured wall-clock latency.
     * @param timestamp When the probe completed.
     * @return The immutable component result.
     */
    public ComponentResult assess(String name, Priority priority, ProbeOutcome outcome, double latencyMs, Instant timestamp) {
        Map<String, Object> detail = new LinkedHashMap<>();
        if (outcome instanceof ProbeOutcome.Success success) {
            detail.putAll(success.detail());
            if (success.statusHint() == HealthStatus.DEGRADED) {
                if (priority == Priority.OPTIONAL) {
                    detail.put(OPTIONAL_DEGRADED, true);
                    return new ComponentResult(name, priority, HealthStatus.HEALTHY, 1.0, latencyMs, timestamp, detail, null, List.of());
                }
                return new ComponentResult(name, priority, HealthStatus.DEGRADED, 0.5, latencyMs, timestamp, detail, null, List.of());
            }
            return new ComponentResult(name, priority, HealthStatus.HEALTHY, 1.0, latencyMs, timestamp, detail, null, List.of());
        }

        ProbeOutcome.Failure failure = (ProbeOutcome.Failure) outcome;
        detail.putAll(failure.detail());
        List<String> rootCause = RootCauseAnalyzer.fiveWhys(name, failure.message());
        return switch (priority) {
            case CRITICAL -> new ComponentResult(name, priority, HealthStatus.UNHEALTHY, 0.0, latencyMs, timestamp,
                detail, failure.message(), rootCause);
            case IMPORTANT -> new ComponentResult(name, priority, HealthStatus.DEGRADED, 0.5, latencyMs, timestamp,
                detail, failure.message(), rootCause);
            case OPTIONAL -> {
                detail.put(OPTIONAL_UNAVAILABLE, true);
                yield new ComponentResult(name, priority, HealthStatus.HEALTHY, 1.0, latencyMs, timestamp,
                    detail, failure.message(), rootCause);
            }
        };
    }

    /**
     * Synthesises the result for a probe skipped because its breaker is open.
     *
     * @param name      The component name.
     * @param priority  The component priority for this cycle.
     * @param record    The failure record that kept the breaker open.
     * @param timestamp When the skip was decided.
     * @return A CIRCUIT_OPEN result with zero latency.
     */
    public ComponentResult circuitOpen(String name, Priority priority, FailureRecord record, Instant timestamp) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("consecutive_failures", record.consecutiveFailures());
        if (record.lastFailureAt() != null) {
            detail.put("last_failure_at", record.lastFailureAt().toString());
        }
        String message = "circuit open: probe skipped after " + record.consecutiveFailures() + " consecutive failures";
        return new ComponentResult(name, priority, HealthStatus.CIRCUIT_OPEN, failureContribution(priority), 0.0,
            timestamp, detail, message, RootCauseAnalyzer.fiveWhys(name, message));
    }

    /**
     * Score contribution of a failed (or skipped) component of the given priority.
     */
    static double failureContribution(Priority priority) {
        return switch (priority) {
            case CRITICAL -> 0.0;
            case IMPORTANT -> 0.5;
            case OPTIONAL -> 1.0;
        };
    }
}
