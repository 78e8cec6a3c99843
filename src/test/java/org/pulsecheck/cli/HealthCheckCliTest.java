package org.pulsecheck.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.pulsecheck.cli.config.LoggingConfigurator;
import org.pulsecheck.junit.extensions.logging.AllowLog;
import org.pulsecheck.junit.extensions.logging.LogLevel;
import org.pulsecheck.junit.extensions.logging.LogWatchExtension;
import org.pulsecheck.monitor.api.probes.AbstractProbe;
import org.pulsecheck.monitor.api.probes.ProbeOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.WARN, loggerPattern = ".*CheckRunner", messagePattern = "Probe '.*' failed .*")
class HealthCheckCliTest {

    /**
     * Probe whose outcome is fixed by its {@code fail} option.
     */
    public static class ScriptedProbe extends AbstractProbe {

        public ScriptedProbe(String name, Config options) {
            super(name, options);
        }

        @Override
        public ProbeOutcome probe() {
            return options.hasPath("fail")
                ? ProbeOutcome.failure(options.getString("fail"))
                : ProbeOutcome.healthy();
        }
    }

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();

    @AfterEach
    void resetLogging() {
        LoggingConfigurator.reset();
    }

    private Path writeConfig(String cacheOptions, String dbOptions) throws IOException {
        String probe = ScriptedProbe.class.getName();
        return Files.writeString(tempDir.resolve("pulsecheck.conf"), String.format("""
            pulsecheck {
              environment = "production"
              probe-order = ["db", "cache"]
              probes {
                db { className = "%1$s", options { %3$s } }
                cache { className = "%1$s", options { %2$s } }
              }
            }
            logging.default-level = "WARN"
            """, probe, cacheOptions, dbOptions));
    }

    private int execute(String... args) {
        CommandLine commandLine = new CommandLine(new HealthCheckCli());
        commandLine.setOut(new PrintWriter(out));
        return commandLine.execute(args);
    }

    @Test
    void healthySystemExitsZero() throws IOException {
        Path config = writeConfig("", "");

        int exitCode = execute("--config", config.toString(), "check");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Overall: HEALTHY").contains("db").contains("cache");
    }

    @Test
    void degradedSystemExitsOne() throws IOException {
        Path config = writeConfig("fail = \"refused\"", "");

        int exitCode = execute("--config", config.toString(), "check");

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("Overall: DEGRADED").contains("refused");
    }

    @Test
    void unhealthySystemExitsTwo() throws IOException {
        Path config = writeConfig("", "fail = \"connection refused\"");

        int exitCode = execute("--config", config.toString(), "check", "--env", "staging", "--timeout", "2");

        assertThat(exitCode).isEqualTo(2);
        assertThat(out.toString()).contains("Overall: UNHEALTHY").contains("environment=staging");
    }

    @Test
    @AllowLog(level = LogLevel.INFO, loggerPattern = ".*ReportExporter")
    void exportWritesReportToGivenPath() throws IOException {
        Path config = writeConfig("", "");
        Path target = tempDir.resolve("out/report.json");

        int exitCode = execute("--config", config.toString(), "check", "--export", target.toString());

        assertThat(exitCode).isZero();
        assertThat(target).exists();
        assertThat(Files.readString(target)).contains("\"environment\" : \"production\"");
    }

    @Test
    void probesCommandListsResolvedPriorities() throws IOException {
        Path config = writeConfig("", "");

        int exitCode = execute("--config", config.toString(), "probes", "--env", "development");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .containsPattern("db\\s+CRITICAL")
            .containsPattern("cache\\s+OPTIONAL");
    }

    @Test
    void missingConfigFileFails() {
        int exitCode = execute("--config", tempDir.resolve("absent.conf").toString(), "check");

        assertThat(exitCode).isNotZero();
    }

    @Test
    void environmentVariableOverridesConfigFile() {
        Config fileConfig = ConfigFactory.parseString("pulsecheck.environment = staging");

        Config withVariable = HealthCheckCli.layer(fileConfig, Map.of(HealthCheckCli.ENVIRONMENT_VARIABLE, "production"));
        Config withoutVariable = HealthCheckCli.layer(fileConfig, Map.of());

        assertThat(withVariable.getString("pulsecheck.environment")).isEqualTo("production");
        assertThat(withoutVariable.getString("pulsecheck.environment")).isEqualTo("staging");
    }
}
