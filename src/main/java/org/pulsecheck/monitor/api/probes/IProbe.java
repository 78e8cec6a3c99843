package org.pulsecheck.monitor.api.probes;

/**
 * A named, side-effect-bounded check against exactly one dependency.
 * <p>
 * Implementations contact their target (a database, a cache, an endpoint, a host resource)
 * and describe what they saw as a {@link ProbeOutcome}. A probe does not enforce its own
 * timeout: the caller time-boxes every invocation and interrupts the calling thread when
 * the allotted time is exceeded, so blocking implementations should honour interruption.
 * <p>
 * Throwing is permitted and is treated exactly like returning a {@link ProbeOutcome.Failure}
 * carrying the exception message. Probes must not share mutable state with each other.
 */
@FunctionalInterface
public interface IProbe {

    /**
     * Runs the check once.
     *
     * @return the outcome of the check, never {@code null}.
     * @throws Exception if the dependency could not be checked.
     */
    ProbeOutcome probe() throws Exception;
}
