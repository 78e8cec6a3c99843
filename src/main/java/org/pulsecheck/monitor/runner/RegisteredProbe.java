package org.pulsecheck.monitor.runner;

import org.pulsecheck.monitor.api.probes.IProbe;

import java.util.Objects;

/**
 * A probe together with the component name it was registered under.
 *
 * @param name  The component name.
 * @param probe The probe checking that component.
 */
public record RegisteredProbe(String name, IProbe probe) {

    public RegisteredProbe {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(probe, "probe");
    }
}
