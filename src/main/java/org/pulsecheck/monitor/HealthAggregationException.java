package org.pulsecheck.monitor;

/**
 * Exception thrown when a check cycle cannot produce a meaningful report.
 * <p>
 * This is the only failure that escapes {@link HealthMonitor#runFullCheck(String, java.time.Duration)}.
 * Per-component failures never raise it; they are folded into the report. It signals a
 * structural problem instead:
 * <ul>
 *   <li>No components are registered</li>
 *   <li>The runner did not return exactly one result per registered component</li>
 *   <li>The checking thread was interrupted before the cycle could complete</li>
 * </ul>
 */
public class HealthAggregationException extends RuntimeException {

    /**
     * @param message the detail message explaining the failure
     */
    public HealthAggregationException(String message) {
        super(message);
    }

    /**
     * @param message the detail message explaining the failure
     * @param cause the underlying cause of the failure
     */
    public HealthAggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
