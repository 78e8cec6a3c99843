package org.pulsecheck.monitor.api.report;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The immutable snapshot produced by one full check cycle.
 *
 * @param overallStatus   Priority-first verdict for the whole system.
 * @param healthScore     Weighted health score in [0, 1].
 * @param timestamp       When the report was assembled.
 * @param environment     The environment name the priorities were resolved for.
 * @param checkDurationMs Wall-clock duration of the check cycle.
 * @param components      One result per registered component, in registration order.
 * @param breakdown       Secondary, count-based summary.
 * @param systemMetrics   Host resource snapshot.
 * @param platformInfo    Host and runtime identification.
 * @param recommendations Ordered operator-facing recommendations.
 */
public record SystemHealthReport(
    HealthStatus overallStatus,
    double healthScore,
    Instant timestamp,
    String environment,
    double checkDurationMs,
    List<ComponentResult> components,
    StatusBreakdown breakdown,
    SystemMetrics systemMetrics,
    PlatformInfo platformInfo,
    List<String> recommendations
) {

    public SystemHealthReport {
        Objects.requireNonNull(overallStatus, "overallStatus");
        Objects.requireNonNull(timestamp, "timestamp");
        if (healthScore < 0.0 || healthScore > 1.0) {
            throw new IllegalArgumentException("healthScore must be within [0, 1], got: " + healthScore);
        }
        components = List.copyOf(components);
        recommendations = List.copyOf(recommendations);
    }

    /**
     * Looks up the result of a component by name.
     *
     * @param name The component name.
     * @return The result, or empty if no such component was part of this report.
     */
    public Optional<ComponentResult> component(String name) {
        return components.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    /**
     * Reduces this report to the summary served by cheap polling.
     */
    public ReportSummary toSummary() {
        return new ReportSummary(
            overallStatus,
            healthScore,
            breakdown.healthy(),
            breakdown.degraded(),
            breakdown.unhealthy(),
            breakdown.total(),
            timestamp
        );
    }
}
