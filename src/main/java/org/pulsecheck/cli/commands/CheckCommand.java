package org.pulsecheck.cli.commands;

import com.typesafe.config.Config;
import org.pulsecheck.cli.HealthCheckCli;
import org.pulsecheck.monitor.HealthMonitor;
import org.pulsecheck.monitor.api.report.ComponentResult;
import org.pulsecheck.monitor.api.report.SystemHealthReport;
import org.pulsecheck.monitor.config.MonitorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "check",
    description = "Runs one health check cycle over the configured probes."
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    static final int EXIT_HEALTHY = 0;
    static final int EXIT_DEGRADED = 1;
    static final int EXIT_UNHEALTHY = 2;

    @ParentCommand
    private HealthCheckCli parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-e", "--env"}, description = "Environment name (default: pulsecheck.environment)")
    private String environment;

    @Option(names = {"-t", "--timeout"}, description = "Per-probe timeout in seconds (default: pulsecheck.check.timeout)")
    private Double timeoutSeconds;

    @Option(names = "--export", arity = "0..1", fallbackValue = "",
        description = "Export the report as JSON, optionally to the given path")
    private String exportPath;

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getConfig();
        final PrintWriter out = spec.commandLine().getOut();

        try (HealthMonitor monitor = HealthMonitor.fromConfig(config)) {
            final MonitorSettings settings = MonitorSettings.fromConfig(config);
            final String env = environment != null ? environment : settings.environment();
            final Duration timeout = timeoutSeconds != null
                ? Duration.ofMillis(Math.round(timeoutSeconds * 1000))
                : settings.perProbeTimeout();

            final SystemHealthReport report = monitor.runFullCheck(env, timeout);
            printSummary(out, report);

            if (exportPath != null) {
                final Path written = monitor.exportReport(report, exportPath.isBlank() ? null : Path.of(exportPath));
                out.println("Report written to " + written.toAbsolutePath());
            }
            out.flush();
            return exitCode(report);
        }
    }

    static int exitCode(SystemHealthReport report) {
        switch (report.overallStatus()) {
            case HEALTHY:
                return EXIT_HEALTHY;
            case DEGRADED:
                return EXIT_DEGRADED;
            default:
                log.debug("Overall status {} maps to exit code {}", report.overallStatus(), EXIT_UNHEALTHY);
                return EXIT_UNHEALTHY;
        }
    }

    static void printSummary(PrintWriter out, SystemHealthReport report) {
        out.printf(Locale.ROOT, "Overall: %s  score=%.2f  environment=%s  duration=%dms%n",
            report.overallStatus(), report.healthScore(), report.environment(), Math.round(report.checkDurationMs()));
        out.printf("%-24s %-10s %-13s %8s  %s%n", "COMPONENT", "PRIORITY", "STATUS", "LATENCY", "ERROR");
        for (ComponentResult c : report.components()) {
            out.printf("%-24s %-10s %-13s %6dms  %s%n", c.name(), c.priority(), c.status(),
                Math.round(c.latencyMs()), c.hasError() ? c.errorMessage() : "");
        }
        out.println();
        out.println("Recommendations:");
        for (String recommendation : report.recommendations()) {
            out.println("  - " + recommendation);
        }
    }
}
