package org.pulsecheck.monitor.report;

import org.pulsecheck.monitor.api.report.SystemMetrics;

/**
 * Source of the host resource snapshot attached to every report.
 */
@FunctionalInterface
public interface ISystemMetricsProvider {

    /**
     * Reads the current resource usage. Implementations must not throw; values the
     * platform cannot provide are reported as {@link SystemMetrics#UNAVAILABLE}.
     *
     * @return the snapshot.
     */
    SystemMetrics snapshot();
}
