package org.pulsecheck.monitor.report;

import org.pulsecheck.monitor.api.report.SystemMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads host resource usage through the platform MXBeans.
 * <p>
 * CPU and physical memory come from {@code com.sun.management.OperatingSystemMXBean} when the
 * running JVM provides it; disk usage is measured on the volume that holds {@code diskPath}.
 * Anything the platform does not expose is reported as {@link SystemMetrics#UNAVAILABLE}.
 */
public class JvmSystemMetricsProvider implements ISystemMetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(JvmSystemMetricsProvider.class);

    private final File diskPath;

    public JvmSystemMetricsProvider() {
        this(new File("."));
    }

    /**
     * @param diskPath A path on the volume whose usage should be reported.
     */
    public JvmSystemMetricsProvider(File diskPath) {
        this.diskPath = diskPath;
    }

    @Override
    public SystemMetrics snapshot() {
        double cpu = SystemMetrics.UNAVAILABLE;
        double memory = SystemMetrics.UNAVAILABLE;
        double load = SystemMetrics.UNAVAILABLE;

        try {
            OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
            double systemLoad = osBean.getSystemLoadAverage();
            if (systemLoad >= 0) {
                load = systemLoad;
            }
            if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
                double cpuLoad = sunBean.getCpuLoad();
                if (cpuLoad >= 0) {
                    cpu = cpuLoad * 100.0;
                }
                long total = sunBean.getTotalMemorySize();
                long free = sunBean.getFreeMemorySize();
                if (total > 0) {
                    memory = ((total - free) * 100.0) / total;
                }
            }
        } catch (Exception e) {
            log.debug("Operating system metrics not available: {}", e.getMessage());
        }

        return new SystemMetrics(cpu, memory, diskPercent(), heapPercent(), threadCount(), load);
    }

    private double diskPercent() {
        long total = diskPath.getTotalSpace();
        if (total <= 0) {
            return SystemMetrics.UNAVAILABLE;
        }
        long usable = diskPath.getUsableSpace();
        return ((total - usable) * 100.0) / total;
    }

    private static double heapPercent() {
        Runtime runtime = Runtime.getRuntime();
        long max = runtime.maxMemory();
        if (max <= 0 || max == Long.MAX_VALUE) {
            return SystemMetrics.UNAVAILABLE;
        }
        long used = runtime.totalMemory() - runtime.freeMemory();
        return (used * 100.0) / max;
    }

    private static int threadCount() {
        return ManagementFactory.getThreadMXBean().getThreadCount();
    }
}
