package org.pulsecheck.monitor.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.pulsecheck.monitor.api.probes.IProbe;
import org.pulsecheck.monitor.runner.RegisteredProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Instantiates the probes declared under {@code pulsecheck.probes}.
 * <p>
 * <strong>Usage in pulsecheck.conf:</strong>
 * <pre>
 * pulsecheck {
 *   probe-order = ["postgres", "redis", "system_resources"]
 *   probes {
 *     postgres {
 *       className = "org.pulsecheck.monitor.probes.JdbcProbe"
 *       options { url = "jdbc:postgresql://db:5432/app", user = "health" }
 *     }
 *     redis {
 *       className = "org.pulsecheck.monitor.probes.TcpConnectProbe"
 *       options { host = "cache", port = 6379 }
 *     }
 *   }
 * }
 * </pre>
 * Each class must implement {@link IProbe} and expose a public {@code (String name, Config options)}
 * constructor. Probes are returned in {@code probe-order} first; declared probes missing from that
 * list follow in alphabetical order, so registration order never depends on HOCON key ordering.
 * A definition that cannot be instantiated is logged and skipped.
 */
public final class ProbeRegistryLoader {

    private static final Logger log = LoggerFactory.getLogger(ProbeRegistryLoader.class);

    private ProbeRegistryLoader() {
    }

    /**
     * @param rootConfig The application configuration.
     * @return The instantiated probes in registration order.
     */
    public static List<RegisteredProbe> load(Config rootConfig) {
        String probesPath = MonitorSettings.ROOT_PATH + ".probes";
        if (!rootConfig.hasPath(probesPath)) {
            log.debug("No probes configured.");
            return List.of();
        }
        Config probesConfig = rootConfig.getConfig(probesPath);

        Set<String> ordered = new LinkedHashSet<>();
        String orderPath = MonitorSettings.ROOT_PATH + ".probe-order";
        if (rootConfig.hasPath(orderPath)) {
            for (String name : rootConfig.getStringList(orderPath)) {
                if (probesConfig.root().containsKey(name)) {
                    ordered.add(name);
                } else {
                    log.warn("probe-order references undefined probe '{}', ignoring it", name);
                }
            }
        }
        ordered.addAll(new TreeSet<>(probesConfig.root().keySet()));

        List<RegisteredProbe> probes = new ArrayList<>();
        for (String name : ordered) {
            try {
                Config definition = probesConfig.getConfig("\"" + name + "\"");
                String className = definition.getString("className");
                Config options = definition.hasPath("options")
                    ? definition.getConfig("options")
                    : ConfigFactory.empty();

                Object instance = Class.forName(className)
                    .getConstructor(String.class, Config.class)
                    .newInstance(name, options);
                if (!(instance instanceof IProbe probe)) {
                    throw new IllegalArgumentException(className + " does not implement " + IProbe.class.getSimpleName());
                }
                probes.add(new RegisteredProbe(name, probe));
                log.info("Instantiated probe '{}' of type {}", name, className);
            } catch (Exception e) {
                Throwable cause = e instanceof InvocationTargetException && e.getCause() != null ? e.getCause() : e;
                log.error("Failed to instantiate probe '{}': {}. Skipping this probe.", name, cause.getMessage());
            }
        }
        return probes;
    }
}
