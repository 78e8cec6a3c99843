package org.pulsecheck.monitor.api.probes;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Abstract base class for configurable probes, providing common name and option handling.
 * <p>
 * Subclasses are instantiated reflectively by {@link org.pulsecheck.monitor.config.ProbeRegistryLoader}
 * and must therefore expose a public {@code (String name, Config options)} constructor.
 * Option defaults are declared once via {@link #defaults()} and merged underneath the
 * configured options, so subclasses can read every key without {@code hasPath} checks.
 */
public abstract class AbstractProbe implements IProbe {

    protected final String probeName;
    protected final Config options;

    /**
     * @param name    The component name this probe is registered under.
     * @param options The configuration object for this probe instance.
     */
    protected AbstractProbe(String name, Config options) {
        this.probeName = Objects.requireNonNull(name, "Probe name cannot be null");
        Objects.requireNonNull(options, "Probe options cannot be null");
        this.options = options.withFallback(ConfigFactory.parseMap(defaults()));
    }

    /**
     * Default values for this probe's options. Keys missing from the configured
     * options fall back to these values.
     *
     * @return Map of option keys to default values (empty by default).
     */
    protected Map<String, Object> defaults() {
        return Map.of();
    }

    public String getProbeName() {
        return probeName;
    }

    /**
     * Returns the effective options (configured values merged over defaults).
     *
     * @return The configuration object.
     */
    public Config getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + probeName + "]";
    }
}
