package org.pulsecheck.monitor.api.report;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of checking one component during one check cycle.
 * <p>
 * Instances are immutable: the detail map and the root-cause chain are defensively copied.
 *
 * @param name              The component name as registered.
 * @param priority          The priority the component was classified with for this cycle.
 * @param status            The component status after the degradation policy was applied.
 * @param scoreContribution Contribution of this component to the weighted health score, in [0, 1].
 * @param latencyMs         Wall-clock time spent in the probe, zero when the probe was skipped.
 * @param timestamp         When the result was produced.
 * @param detail            Ordered diagnostic payload.
 * @param errorMessage      The failure message, or {@code null} if the probe succeeded.
 * @param rootCause         Causal chain ending in a remediation sentence; empty if the probe succeeded.
 */
public record ComponentResult(
    String name,
    Priority priority,
    HealthStatus status,
    double scoreContribution,
    double latencyMs,
    Instant timestamp,
    Map<String, Object> detail,
    String errorMessage,
    List<String> rootCause
) {

    public ComponentResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(timestamp, "timestamp");
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must be >= 0, got: " + latencyMs);
        }
        if (scoreContribution < 0.0 || scoreContribution > 1.0) {
            throw new IllegalArgumentException("scoreContribution must be within [0, 1], got: " + scoreContribution);
        }
        detail = detail == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
        rootCause = rootCause == null ? List.of() : List.copyOf(rootCause);
    }

    public boolean hasError() {
        return errorMessage != null;
    }

    /**
     * Returns the last element of the root-cause chain, which is the remediation sentence.
     *
     * @return the remediation, or {@code null} if no chain was generated.
     */
    public String remediation() {
        return rootCause.isEmpty() ? null : rootCause.get(rootCause.size() - 1);
    }
}
