package org.pulsecheck.monitor.api.report;

/**
 * Point-in-time resource snapshot of the host the monitor runs on.
 * <p>
 * Percentages are in [0, 100]. A value of {@code -1} means the platform did not report it.
 *
 * @param cpuPercent     System-wide CPU load.
 * @param memoryPercent  Physical memory in use.
 * @param diskPercent    Disk usage of the volume holding the working directory.
 * @param heapPercent    JVM heap in use relative to the maximum heap.
 * @param threadCount    Live JVM threads.
 * @param loadAverage    One-minute system load average, {@code -1} if unavailable.
 */
public record SystemMetrics(
    double cpuPercent,
    double memoryPercent,
    double diskPercent,
    double heapPercent,
    int threadCount,
    double loadAverage
) {

    public static final double UNAVAILABLE = -1.0;

    public static SystemMetrics unavailable() {
        return new SystemMetrics(UNAVAILABLE, UNAVAILABLE, UNAVAILABLE, UNAVAILABLE, 0, UNAVAILABLE);
    }
}
