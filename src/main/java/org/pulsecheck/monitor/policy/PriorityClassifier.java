package org.pulsecheck.monitor.policy;

import org.pulsecheck.monitor.api.report.Priority;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps a component name and an environment name to a {@link Priority}.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>Fixed base priorities: the primary relational store is always CRITICAL, thread and
 *       host-resource liveness are always IMPORTANT. Overrides cannot change these.</li>
 *   <li>Configured overrides for the resolved environment.</li>
 *   <li>The built-in environment table (see {@link #tablePriority(String, Environment)}).</li>
 *   <li>IMPORTANT for any component the table does not know.</li>
 * </ol>
 * <p>
 * The classifier holds no mutable state and can be called concurrently without locking.
 * Priorities are computed on every call, so a changed environment name takes effect immediately.
 */
public final class PriorityClassifier {

    private static final Set<String> ALWAYS_CRITICAL = Set.of("postgres", "database", "db");
    private static final Set<String> ALWAYS_IMPORTANT = Set.of("background_tasks", "system_resources");

    private final Map<Environment, Map<String, Priority>> overrides;

    public PriorityClassifier() {
        this(Map.of());
    }

    /**
     * @param overrides Per-environment component priorities consulted before the built-in table.
     */
    public PriorityClassifier(Map<Environment, Map<String, Priority>> overrides) {
        Map<Environment, Map<String, Priority>> copy = new EnumMap<>(Environment.class);
        overrides.forEach((env, table) -> {
            Map<String, Priority> normalized = new HashMap<>();
            table.forEach((component, priority) -> normalized.put(component.trim().toLowerCase(Locale.ROOT), priority));
            copy.put(env, Map.copyOf(normalized));
        });
        this.overrides = copy;
    }

    /**
     * Classifies a component for an environment.
     *
     * @param componentName The registered component name.
     * @param environment   The environment name supplied by the caller.
     * @return The priority, never {@code null}.
     */
    public Priority priority(String componentName, String environment) {
        return priority(componentName, Environment.fromName(environment));
    }

    public Priority priority(String componentName, Environment environment) {
        String name = componentName == null ? "" : componentName.trim().toLowerCase(Locale.ROOT);
        if (ALWAYS_CRITICAL.contains(name)) {
            return Priority.CRITICAL;
        }
        if (ALWAYS_IMPORTANT.contains(name)) {
            return Priority.IMPORTANT;
        }
        Priority configured = overrides.getOrDefault(environment, Map.of()).get(name);
        if (configured != null) {
            return configured;
        }
        Priority fromTable = tablePriority(name, environment);
        return fromTable != null ? fromTable : Priority.IMPORTANT;
    }

    /**
     * Built-in table of external services per environment.
     * <ul>
     *   <li>staging: everything external is CRITICAL except explicitly optional telemetry sinks.</li>
     *   <li>production: the instance must survive losing analytics and telemetry, and the cache is a
     *       performance concern only.</li>
     *   <li>development/testing: local work must not be blocked by missing infrastructure.</li>
     * </ul>
     *
     * @return the table entry, or {@code null} if the component is not listed.
     */
    static Priority tablePriority(String name, Environment environment) {
        return switch (environment) {
            case STAGING -> switch (name) {
                case "redis", "cache", "clickhouse", "websocket", "auth_service", "llm_service" -> Priority.CRITICAL;
                case "search", "analytics", "metrics_exporter" -> Priority.OPTIONAL;
                default -> null;
            };
            case PRODUCTION -> switch (name) {
                case "websocket", "auth_service" -> Priority.CRITICAL;
                case "redis", "cache", "llm_service" -> Priority.IMPORTANT;
                case "clickhouse", "search", "analytics", "metrics_exporter" -> Priority.OPTIONAL;
                default -> null;
            };
            case DEVELOPMENT, TESTING -> switch (name) {
                case "websocket", "auth_service" -> Priority.IMPORTANT;
                case "redis", "cache", "clickhouse", "search", "llm_service", "analytics", "metrics_exporter" -> Priority.OPTIONAL;
                default -> null;
            };
        };
    }
}
