package org.pulsecheck.monitor.api;

import java.util.Map;

/**
 * An interface for components that expose their own operational state.
 * <p>
 * The health monitor itself implements this so that a surrounding application can
 * scrape counters about the monitoring engine (cycles run, probes failed, circuits open)
 * without triggering a new check cycle.
 */
public interface IMonitorable {

    /**
     * Returns a map of metrics for the component.
     * <p>
     * The keys are metric names (e.g., "cycles_total", "circuits_open") and the
     * values are the corresponding numeric values. The format is designed to be
     * compatible with monitoring systems like Prometheus.
     *
     * @return A map of metric names to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * Indicates whether the component is currently operational.
     *
     * @return true if the component is healthy, false if it is in a failed state.
     */
    boolean isHealthy();
}
