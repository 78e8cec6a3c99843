package org.pulsecheck.monitor.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.pulsecheck.monitor.api.report.Priority;
import org.pulsecheck.monitor.policy.Environment;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Typed view of the {@code pulsecheck} configuration section.
 * <p>
 * <strong>Usage in pulsecheck.conf:</strong>
 * <pre>
 * pulsecheck {
 *   environment = "production"
 *   check {
 *     timeout = 10s          # per-probe timeout
 *     cycle-deadline = 0s    # 0 = no cycle-level deadline
 *     max-concurrency = 16
 *   }
 *   breaker {
 *     failure-threshold = 5
 *     cooldown = 300s
 *   }
 *   export.directory = "reports"
 *   priorities.overrides {
 *     production { redis = OPTIONAL }
 *   }
 * }
 * </pre>
 *
 * @param environment      Environment name handed to the monitor for classification.
 * @param perProbeTimeout  Maximum running time of one probe.
 * @param cycleDeadline    Maximum duration of one cycle, {@link Duration#ZERO} for none.
 * @param maxConcurrency   Number of probe worker threads.
 * @param failureThreshold Consecutive failures that open a breaker.
 * @param breakerCooldown  Time after the last failure before an open breaker lets probes through again.
 * @param exportDirectory  Directory for exported reports with derived names.
 * @param priorityOverrides Per-environment priority overrides.
 */
public record MonitorSettings(
    String environment,
    Duration perProbeTimeout,
    Duration cycleDeadline,
    int maxConcurrency,
    int failureThreshold,
    Duration breakerCooldown,
    Path exportDirectory,
    Map<Environment, Map<String, Priority>> priorityOverrides
) {

    public static final String ROOT_PATH = "pulsecheck";

    /**
     * Settings from {@code reference.conf} only.
     */
    public static MonitorSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Reads settings from a root configuration, falling back to the shipped defaults for missing keys.
     *
     * @param rootConfig The application configuration (containing a {@code pulsecheck} section).
     * @return The settings.
     * @throws ConfigException if a value has the wrong type or is out of range.
     */
    public static MonitorSettings fromConfig(Config rootConfig) {
        Config config = rootConfig.withFallback(ConfigFactory.defaultReference()).getConfig(ROOT_PATH);

        int maxConcurrency = config.getInt("check.max-concurrency");
        if (maxConcurrency < 1) {
            throw new ConfigException.BadValue(config.origin(), "check.max-concurrency", "must be at least 1");
        }
        Duration timeout = config.getDuration("check.timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new ConfigException.BadValue(config.origin(), "check.timeout", "must be positive");
        }
        int threshold = config.getInt("breaker.failure-threshold");
        if (threshold < 1) {
            throw new ConfigException.BadValue(config.origin(), "breaker.failure-threshold", "must be at least 1");
        }
        Duration cooldown = config.getDuration("breaker.cooldown");
        if (cooldown.isNegative()) {
            throw new ConfigException.BadValue(config.origin(), "breaker.cooldown", "must not be negative");
        }

        return new MonitorSettings(
            config.getString("environment"),
            timeout,
            config.getDuration("check.cycle-deadline"),
            maxConcurrency,
            threshold,
            cooldown,
            Path.of(config.getString("export.directory")),
            readOverrides(config)
        );
    }

    private static Map<Environment, Map<String, Priority>> readOverrides(Config config) {
        Map<Environment, Map<String, Priority>> overrides = new EnumMap<>(Environment.class);
        if (!config.hasPath("priorities.overrides")) {
            return overrides;
        }
        Config overridesConfig = config.getConfig("priorities.overrides");
        for (String environmentName : overridesConfig.root().keySet()) {
            Environment environment = Environment.fromName(environmentName);
            Config table = overridesConfig.getConfig(quote(environmentName));
            Map<String, Priority> priorities = overrides.computeIfAbsent(environment, e -> new HashMap<>());
            for (Map.Entry<String, ConfigValue> entry : table.root().entrySet()) {
                String value = entry.getValue().unwrapped().toString();
                try {
                    priorities.put(entry.getKey(), Priority.valueOf(value.trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    throw new ConfigException.BadValue(table.origin(), entry.getKey(),
                        "unknown priority '" + value + "', expected CRITICAL, IMPORTANT or OPTIONAL");
                }
            }
        }
        return overrides;
    }

    private static String quote(String key) {
        return "\"" + key + "\"";
    }
}
