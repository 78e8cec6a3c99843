package org.pulsecheck.monitor.api.report;

import java.time.Instant;

/**
 * Cheap view of the last report for polling callers.
 *
 * @param status    Overall status, {@link HealthStatus#UNKNOWN} if no cycle has run yet.
 * @param score     Weighted health score of the last report, 0 if none.
 * @param healthy   Number of healthy components.
 * @param degraded  Number of degraded components.
 * @param unhealthy Number of unhealthy (including circuit-open) components.
 * @param total     Number of components in the last report.
 * @param timestamp When the last report was produced, {@code null} if none.
 */
public record ReportSummary(
    HealthStatus status,
    double score,
    int healthy,
    int degraded,
    int unhealthy,
    int total,
    Instant timestamp
) {

    public static ReportSummary none() {
        return new ReportSummary(HealthStatus.UNKNOWN, 0.0, 0, 0, 0, 0, null);
    }
}
