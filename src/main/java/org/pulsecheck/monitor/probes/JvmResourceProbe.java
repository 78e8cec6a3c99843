package org.pulsecheck.monitor.probes;

import com.typesafe.config.Config;
import org.pulsecheck.monitor.api.probes.AbstractProbe;
import org.pulsecheck.monitor.api.probes.ProbeOutcome;
import org.pulsecheck.monitor.api.report.SystemMetrics;
import org.pulsecheck.monitor.report.ISystemMetricsProvider;
import org.pulsecheck.monitor.report.JvmSystemMetricsProvider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks host and JVM resource usage against warning and critical thresholds.
 * <p>
 * A value above its {@code *-warn} threshold yields a degraded hint; a value above its
 * {@code *-critical} threshold fails the probe. Unavailable figures are ignored.
 * <p>
 * <strong>Options</strong> (percentages): {@code heap-warn} 85, {@code heap-critical} 95,
 * {@code cpu-warn} 80, {@code cpu-critical} 95, {@code disk-warn} 85, {@code disk-critical} 95,
 * {@code memory-warn} 90, {@code memory-critical} 98.
 */
public class JvmResourceProbe extends AbstractProbe {

    private final ISystemMetricsProvider metricsProvider;

    public JvmResourceProbe(String name, Config options) {
        this(name, options, new JvmSystemMetricsProvider());
    }

    public JvmResourceProbe(String name, Config options, ISystemMetricsProvider metricsProvider) {
        super(name, options);
        this.metricsProvider = metricsProvider;
    }

    @Override
    protected Map<String, Object> defaults() {
        return Map.of(
            "heap-warn", 85.0, "heap-critical", 95.0,
            "cpu-warn", 80.0, "cpu-critical", 95.0,
            "disk-warn", 85.0, "disk-critical", 95.0,
            "memory-warn", 90.0, "memory-critical", 98.0);
    }

    @Override
    public ProbeOutcome probe() {
        SystemMetrics metrics = metricsProvider.snapshot();
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("heap_percent", metrics.heapPercent());
        detail.put("cpu_percent", metrics.cpuPercent());
        detail.put("memory_percent", metrics.memoryPercent());
        detail.put("disk_percent", metrics.diskPercent());
        detail.put("thread_count", metrics.threadCount());

        List<String> critical = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        evaluate("heap", metrics.heapPercent(), critical, warnings);
        evaluate("cpu", metrics.cpuPercent(), critical, warnings);
        evaluate("memory", metrics.memoryPercent(), critical, warnings);
        evaluate("disk", metrics.diskPercent(), critical, warnings);

        if (!critical.isEmpty()) {
            return ProbeOutcome.failure("resource exhaustion: " + String.join(", ", critical), detail);
        }
        if (!warnings.isEmpty()) {
            detail.put("warnings", String.join(", ", warnings));
            return ProbeOutcome.degraded(detail);
        }
        return ProbeOutcome.healthy(detail);
    }

    private void evaluate(String resource, double value, List<String> critical, List<String> warnings) {
        if (value == SystemMetrics.UNAVAILABLE) {
            return;
        }
        String text = String.format(Locale.ROOT, "%s at %.1f%%", resource, value);
        if (value >= options.getDouble(resource + "-critical")) {
            critical.add(text);
        } else if (value >= options.getDouble(resource + "-warn")) {
            warnings.add(text);
        }
    }
}
