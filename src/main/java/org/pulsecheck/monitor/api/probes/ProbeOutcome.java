package org.pulsecheck.monitor.api.probes;

import org.pulsecheck.monitor.api.report.HealthStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed result of a single probe invocation. Either the dependency answered
 * ({@link Success}) or it did not ({@link Failure}).
 */
public sealed interface ProbeOutcome permits ProbeOutcome.Success, ProbeOutcome.Failure {

    /**
     * The dependency answered.
     *
     * @param statusHint Either {@link HealthStatus#HEALTHY} or {@link HealthStatus#DEGRADED}; the latter
     *                   signals that the dependency works but is close to a limit.
     * @param detail     Ordered diagnostic payload (versions, counts, percentages).
     */
    record Success(HealthStatus statusHint, Map<String, Object> detail) implements ProbeOutcome {
        public Success {
            Objects.requireNonNull(statusHint, "statusHint");
            if (statusHint != HealthStatus.HEALTHY && statusHint != HealthStatus.DEGRADED) {
                throw new IllegalArgumentException("A successful probe can only hint HEALTHY or DEGRADED, got: " + statusHint);
            }
            detail = detail == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
        }
    }

    /**
     * The dependency could not be reached or answered with an error.
     *
     * @param message Human-readable description of what went wrong.
     * @param detail  Optional diagnostic payload collected before the failure.
     */
    record Failure(String message, Map<String, Object> detail) implements ProbeOutcome {
        public Failure {
            message = (message == null || message.isBlank()) ? "unknown error" : message;
            detail = detail == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(detail));
        }
    }

    static ProbeOutcome healthy() {
        return new Success(HealthStatus.HEALTHY, Map.of());
    }

    static ProbeOutcome healthy(Map<String, Object> detail) {
        return new Success(HealthStatus.HEALTHY, detail);
    }

    static ProbeOutcome degraded(Map<String, Object> detail) {
        return new Success(HealthStatus.DEGRADED, detail);
    }

    static ProbeOutcome failure(String message) {
        return new Failure(message, Map.of());
    }

    static ProbeOutcome failure(String message, Map<String, Object> detail) {
        return new Failure(message, detail);
    }

    /**
     * Converts a throwable raised by a probe into a failure, preferring the most specific message available.
     */
    static ProbeOutcome fromThrowable(Throwable t) {
        Throwable cause = t;
        while (cause.getMessage() == null && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage() != null
            ? cause.getMessage()
            : cause.getClass().getSimpleName();
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("exception", cause.getClass().getName());
        return new Failure(message, detail);
    }
}
