package org.pulsecheck.monitor.report;

import org.pulsecheck.monitor.api.report.ComponentResult;
import org.pulsecheck.monitor.api.report.HealthStatus;
import org.pulsecheck.monitor.api.report.PlatformInfo;
import org.pulsecheck.monitor.api.report.StatusBreakdown;
import org.pulsecheck.monitor.api.report.SystemHealthReport;
import org.pulsecheck.monitor.api.report.SystemMetrics;
import org.pulsecheck.monitor.policy.HealthScoreAggregator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Assembles component results, host metrics and platform information into a {@link SystemHealthReport}.
 * <p>
 * Recommendations are built in this order:
 * <ol>
 *   <li>One remediation sentence per unhealthy or circuit-open component, taken from its root-cause chain.</li>
 *   <li>One "monitor/optimize" sentence per degraded component.</li>
 *   <li>If neither applied, a single "operating normally" sentence.</li>
 *   <li>One platform advisory when the host is not a Linux system.</li>
 * </ol>
 */
public class ReportBuilder {

    static final String OPERATING_NORMALLY = "All monitored components are operating normally.";

    private final ISystemMetricsProvider metricsProvider;
    private final Supplier<PlatformInfo> platformInfoSupplier;

    public ReportBuilder() {
        this(new JvmSystemMetricsProvider(), PlatformInfoProvider::current);
    }

    /**
     * @param metricsProvider      Source of the resource snapshot.
     * @param platformInfoSupplier Source of platform identification.
     */
    public ReportBuilder(ISystemMetricsProvider metricsProvider, Supplier<PlatformInfo> platformInfoSupplier) {
        this.metricsProvider = Objects.requireNonNull(metricsProvider, "metricsProvider");
        this.platformInfoSupplier = Objects.requireNonNull(platformInfoSupplier, "platformInfoSupplier");
    }

    /**
     * Builds the report for one cycle.
     *
     * @param environment     The environment name of the cycle.
     * @param components      One result per registered component, in registration order; must not be empty.
     * @param checkDurationMs Duration of the cycle.
     * @param timestamp       Report timestamp.
     * @return The immutable report.
     */
    public SystemHealthReport build(String environment, List<ComponentResult> components,
                                    double checkDurationMs, Instant timestamp) {
        HealthStatus overall = HealthScoreAggregator.overallStatus(components);
        double score = HealthScoreAggregator.weightedScore(components);
        StatusBreakdown breakdown = HealthScoreAggregator.breakdown(components);

        SystemMetrics metrics = metricsProvider.snapshot();
        PlatformInfo platform = platformInfoSupplier.get();

        return new SystemHealthReport(
            overall,
            score,
            timestamp,
            environment,
            checkDurationMs,
            components,
            breakdown,
            metrics,
            platform,
            recommendations(components, platform)
        );
    }

    static List<String> recommendations(List<ComponentResult> components, PlatformInfo platform) {
        List<String> recommendations = new ArrayList<>();
        for (ComponentResult component : components) {
            if (component.status().isUnhealthyEquivalent()) {
                String remediation = component.remediation() != null
                    ? component.remediation()
                    : "Investigate the failure and restore the dependency.";
                recommendations.add(component.name() + ": " + remediation);
            }
        }
        for (ComponentResult component : components) {
            if (component.status() == HealthStatus.DEGRADED) {
                String reason = component.hasError() ? component.errorMessage() : "running close to its limits";
                recommendations.add(component.name() + ": degraded (" + reason
                    + "). Monitor it closely and optimize its performance or capacity.");
            }
        }
        if (recommendations.isEmpty()) {
            recommendations.add(OPERATING_NORMALLY);
        }
        String advisory = platformAdvisory(platform);
        if (advisory != null) {
            recommendations.add(advisory);
        }
        return recommendations;
    }

    static String platformAdvisory(PlatformInfo platform) {
        if (platform == null || platform.isLinux()) {
            return null;
        }
        if (platform.isWindows()) {
            return "Running on Windows: file-descriptor and load-average metrics are unavailable; "
                + "verify service dependencies are reachable from the Windows network stack.";
        }
        if (platform.isMac()) {
            return "Running on macOS: suitable for development only; resource figures may not reflect a production host.";
        }
        return "Running on " + platform.osName() + ": this platform is not a tested deployment target; "
            + "treat resource figures with caution.";
    }
}
