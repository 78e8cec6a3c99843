package org.pulsecheck.monitor;

import com.typesafe.config.Config;
import org.pulsecheck.monitor.api.IMonitorable;
import org.pulsecheck.monitor.api.probes.IProbe;
import org.pulsecheck.monitor.api.report.ComponentResult;
import org.pulsecheck.monitor.api.report.HealthStatus;
import org.pulsecheck.monitor.api.report.ReportSummary;
import org.pulsecheck.monitor.api.report.SystemHealthReport;
import org.pulsecheck.monitor.breaker.BreakerState;
import org.pulsecheck.monitor.breaker.FailureHistory;
import org.pulsecheck.monitor.breaker.FailureRecord;
import org.pulsecheck.monitor.config.MonitorSettings;
import org.pulsecheck.monitor.config.ProbeRegistryLoader;
import org.pulsecheck.monitor.policy.DegradationPolicy;
import org.pulsecheck.monitor.policy.PriorityClassifier;
import org.pulsecheck.monitor.report.ReportBuilder;
import org.pulsecheck.monitor.report.ReportExporter;
import org.pulsecheck.monitor.runner.CheckRunner;
import org.pulsecheck.monitor.runner.RegisteredProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owner of all process-scoped health-checking state.
 * <p>
 * One instance is created at startup, probes are registered once, and every call to
 * {@link #runFullCheck(String, Duration)} produces a fresh {@link SystemHealthReport}.
 * The monitor keeps:
 * <ul>
 *   <li>the probe registry, in registration order;</li>
 *   <li>the {@link FailureHistory} that drives the circuit breakers across cycles;</li>
 *   <li>exactly one "last report", replaced wholesale by a single reference swap after each cycle.</li>
 * </ul>
 * Callers that need the state receive this instance explicitly; there are no static singletons.
 * {@link #close()} stops the probe worker pool and ends the monitor's lifecycle.
 */
public class HealthMonitor implements IMonitorable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final Map<String, IProbe> registry = new LinkedHashMap<>();
    private final FailureHistory failureHistory;
    private final CheckRunner runner;
    private final ReportBuilder reportBuilder;
    private final ReportExporter exporter;
    private final PriorityClassifier classifier;
    private final Duration cycleDeadline;
    private final Clock clock;
    private final AtomicReference<SystemHealthReport> lastReport = new AtomicReference<>();

    private final AtomicLong cyclesTotal = new AtomicLong();
    private final AtomicLong probeFailuresTotal = new AtomicLong();
    private final AtomicLong circuitSkipsTotal = new AtomicLong();
    private volatile double lastCycleDurationMs;

    public HealthMonitor() {
        this(MonitorSettings.defaults());
    }

    public HealthMonitor(MonitorSettings settings) {
        this(settings, new ReportBuilder(), Clock.systemUTC());
    }

    /**
     * @param settings      Tunables (timeouts, breaker thresholds, export directory, priority overrides).
     * @param reportBuilder Assembles reports; replaceable to pin host metrics in tests.
     * @param clock         Time source for breaker cooldowns, timestamps and export names.
     */
    public HealthMonitor(MonitorSettings settings, ReportBuilder reportBuilder, Clock clock) {
        Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reportBuilder = Objects.requireNonNull(reportBuilder, "reportBuilder");
        this.failureHistory = new FailureHistory(settings.failureThreshold(), settings.breakerCooldown(), clock);
        this.classifier = new PriorityClassifier(settings.priorityOverrides());
        this.runner = new CheckRunner(failureHistory, classifier, new DegradationPolicy(),
            settings.maxConcurrency(), clock);
        this.exporter = new ReportExporter(settings.exportDirectory(), clock);
        this.cycleDeadline = settings.cycleDeadline();
    }

    /**
     * Creates a monitor from the application configuration and registers every probe declared
     * under {@code pulsecheck.probes}.
     *
     * @param rootConfig The application configuration.
     * @return The monitor, ready for {@link #runFullCheck(String, Duration)}.
     */
    public static HealthMonitor fromConfig(Config rootConfig) {
        HealthMonitor monitor = new HealthMonitor(MonitorSettings.fromConfig(rootConfig));
        for (RegisteredProbe probe : ProbeRegistryLoader.load(rootConfig)) {
            monitor.registerComponent(probe.name(), probe.probe());
        }
        return monitor;
    }

    /**
     * Registers the probe of a component. Components are checked and reported in registration order.
     *
     * @param name  Unique, non-blank component name.
     * @param probe The probe.
     * @throws IllegalArgumentException if the name is blank, the probe is null, or the name is taken.
     */
    public synchronized void registerComponent(String name, IProbe probe) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Component name must not be blank");
        }
        if (probe == null) {
            throw new IllegalArgumentException("Probe for component '" + name + "' must not be null");
        }
        if (registry.containsKey(name)) {
            throw new IllegalArgumentException("Component '" + name + "' is already registered");
        }
        registry.put(name, probe);
        log.debug("Registered component '{}'", name);
    }

    /**
     * Returns the registered component names in registration order.
     */
    public synchronized List<String> getComponentNames() {
        return List.copyOf(registry.keySet());
    }

    /**
     * Runs every registered probe once and builds a report.
     * <p>
     * Per-component failures, timeouts and open circuits are folded into the report; the
     * report always holds exactly one result per registered component.
     *
     * @param environment     Environment name used for priority classification.
     * @param perProbeTimeout Maximum running time of each probe.
     * @return The new report, which also becomes the last report.
     * @throws HealthAggregationException if no components are registered or the cycle produced
     *                                    an inconsistent set of results.
     */
    public SystemHealthReport runFullCheck(String environment, Duration perProbeTimeout) {
        List<RegisteredProbe> probes = snapshotRegistry();
        if (probes.isEmpty()) {
            log.error("Health check requested but no components are registered");
            throw new HealthAggregationException("No components registered; nothing to check");
        }

        log.info("Starting health check of {} components (environment={})", probes.size(), environment);
        long start = System.nanoTime();
        List<ComponentResult> results = runner.runAll(probes, environment, perProbeTimeout, cycleDeadline);
        double durationMs = (System.nanoTime() - start) / 1_000_000.0;

        verifyResults(probes, results);

        SystemHealthReport report = reportBuilder.build(environment, results, durationMs, clock.instant());
        lastReport.set(report);
        recordCycle(report, durationMs);

        log.info("Health check finished in {}ms: status={}, score={}",
            Math.round(durationMs), report.overallStatus(), String.format(Locale.ROOT, "%.2f", report.healthScore()));
        return report;
    }

    /**
     * Summarises the last report without running any probe.
     *
     * @return The summary, or {@link ReportSummary#none()} if no cycle has completed yet.
     */
    public ReportSummary getLastReportSummary() {
        SystemHealthReport report = lastReport.get();
        return report == null ? ReportSummary.none() : report.toSummary();
    }

    /**
     * Returns the last full report, or {@code null} if no cycle has completed yet.
     */
    public SystemHealthReport getLastReport() {
        return lastReport.get();
    }

    /**
     * Writes a report as a JSON document.
     *
     * @param report The report to export.
     * @param path   Target path, or {@code null} for {@code health_report_<yyyyMMdd_HHmmss>.json}
     *               in the configured export directory.
     * @return The written path.
     * @throws IOException if the document could not be written; the last report is unaffected.
     */
    public Path exportReport(SystemHealthReport report, Path path) throws IOException {
        return exporter.export(report, path);
    }

    public Path exportReport(SystemHealthReport report) throws IOException {
        return exporter.export(report, null);
    }

    public FailureRecord getFailureRecord(String component) {
        return failureHistory.getRecord(component);
    }

    public BreakerState getBreakerState(String component) {
        return failureHistory.getState(component);
    }

    /**
     * Clears the failure history of a component so its next probe runs regardless of past failures.
     */
    public void resetBreaker(String component) {
        failureHistory.reset(component);
    }

    public PriorityClassifier getClassifier() {
        return classifier;
    }

    public ReportExporter getExporter() {
        return exporter;
    }

    @Override
    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        SystemHealthReport report = lastReport.get();
        metrics.put("components_registered", getComponentNames().size());
        metrics.put("cycles_total", cyclesTotal.get());
        metrics.put("probe_failures_total", probeFailuresTotal.get());
        metrics.put("circuit_skips_total", circuitSkipsTotal.get());
        metrics.put("circuits_open", failureHistory.openCount());
        metrics.put("last_cycle_duration_ms", lastCycleDurationMs);
        metrics.put("last_health_score", report == null ? 0.0 : report.healthScore());
        return metrics;
    }

    /**
     * The monitored system is considered healthy unless the last report was UNHEALTHY.
     * Before the first cycle nothing is known to be wrong.
     */
    @Override
    public boolean isHealthy() {
        SystemHealthReport report = lastReport.get();
        return report == null || report.overallStatus() != HealthStatus.UNHEALTHY;
    }

    @Override
    public void close() {
        runner.close();
        log.debug("Health monitor closed");
    }

    private synchronized List<RegisteredProbe> snapshotRegistry() {
        List<RegisteredProbe> probes = new ArrayList<>(registry.size());
        registry.forEach((name, probe) -> probes.add(new RegisteredProbe(name, probe)));
        return probes;
    }

    private static void verifyResults(List<RegisteredProbe> probes, List<ComponentResult> results) {
        if (results.size() != probes.size()) {
            throw new HealthAggregationException("Expected " + probes.size() + " component results but got " + results.size());
        }
        for (int i = 0; i < probes.size(); i++) {
            ComponentResult result = results.get(i);
            if (result == null || !result.name().equals(probes.get(i).name())) {
                throw new HealthAggregationException("Missing or misplaced result for component '" + probes.get(i).name() + "'");
            }
        }
    }

    private void recordCycle(SystemHealthReport report, double durationMs) {
        cyclesTotal.incrementAndGet();
        lastCycleDurationMs = durationMs;
        for (ComponentResult component : report.components()) {
            if (component.status() == HealthStatus.CIRCUIT_OPEN) {
                circuitSkipsTotal.incrementAndGet();
            } else if (component.hasError()) {
                probeFailuresTotal.incrementAndGet();
            }
        }
    }
}
