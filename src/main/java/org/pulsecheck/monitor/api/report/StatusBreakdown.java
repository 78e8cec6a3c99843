package org.pulsecheck.monitor.api.report;

/**
 * Coarse, count-based view of a report that ignores priorities.
 * <p>
 * Kept as a secondary statistic next to the priority-first overall status. It can disagree
 * with the primary verdict, e.g. when many optional components are down but every
 * critical one is up.
 *
 * @param healthy      Components with status {@link HealthStatus#HEALTHY}.
 * @param degraded     Components with status {@link HealthStatus#DEGRADED}.
 * @param unhealthy    Components with status {@link HealthStatus#UNHEALTHY} or {@link HealthStatus#CIRCUIT_OPEN}.
 * @param circuitOpen  The subset of {@code unhealthy} that was skipped by an open breaker.
 * @param unknown      Components with status {@link HealthStatus#UNKNOWN}.
 * @param total        Number of components.
 * @param simpleScore  {@code (healthy + 0.5 * degraded) / total}, 0 when there are no components.
 * @param simpleStatus Status derived purely from the percentages.
 */
public record StatusBreakdown(
    int healthy,
    int degraded,
    int unhealthy,
    int circuitOpen,
    int unknown,
    int total,
    double simpleScore,
    HealthStatus simpleStatus
) {
}
