package org.pulsecheck.monitor.breaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-component failure counter and circuit breaker.
 * <p>
 * Each component has a two-state breaker:
 * <ul>
 *   <li><strong>CLOSED → OPEN</strong> when a failure brings {@code consecutiveFailures} to the threshold.</li>
 *   <li><strong>OPEN → CLOSED</strong> when a cycle asks for permission and at least the cooldown has
 *       elapsed since the last failure. There is no trial request: the next probe simply runs, and a
 *       further failure re-opens the breaker immediately because the counter was not reset.</li>
 *   <li>Any success resets the counter to zero and closes the breaker.</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> every read-modify-write goes through {@link ConcurrentHashMap#compute},
 * which serialises updates for the same component while updates for different components
 * proceed independently. Records are immutable snapshots, so readers never see a half-applied update.
 */
public class FailureHistory {

    private static final Logger log = LoggerFactory.getLogger(FailureHistory.class);

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(300);

    private final Map<String, FailureRecord> records = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    public FailureHistory() {
        this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_COOLDOWN, Clock.systemUTC());
    }

    /**
     * @param failureThreshold Consecutive failures that open the breaker, at least 1.
     * @param cooldown         Time after the last failure before an open breaker lets a probe through again.
     * @param clock            Time source, replaceable in tests.
     */
    public FailureHistory(int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be positive, got: " + failureThreshold);
        }
        Objects.requireNonNull(cooldown, "cooldown");
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("Cooldown must not be negative, got: " + cooldown);
        }
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Decides whether the probe of a component may run in the current cycle.
     * <p>
     * Closes an open breaker if the cooldown has elapsed.
     *
     * @param component The component name.
     * @return {@code true} if the probe should run, {@code false} if it must be skipped.
     */
    public boolean allowProbe(String component) {
        Instant now = clock.instant();
        BreakerState[] previousState = new BreakerState[1];
        FailureRecord after = records.compute(component, (name, current) -> {
            FailureRecord record = current == null ? FailureRecord.CLEAN : current;
            previousState[0] = record.state();
            if (record.state() == BreakerState.OPEN && cooldownElapsed(record, now)) {
                return record.withState(BreakerState.CLOSED);
            }
            return record;
        });
        if (previousState[0] == BreakerState.OPEN && after.state() == BreakerState.CLOSED) {
            log.info("Circuit for '{}' closed after {}s cooldown, probing again", component, cooldown.toSeconds());
        }
        return after.state() == BreakerState.CLOSED;
    }

    /**
     * Records a successful probe: resets the counter and closes the breaker.
     *
     * @param component The component name.
     * @return The updated record.
     */
    public FailureRecord recordSuccess(String component) {
        FailureRecord previous = records.put(component, FailureRecord.CLEAN);
        if (previous != null && previous.consecutiveFailures() > 0) {
            log.info("Component '{}' recovered after {} consecutive failures", component, previous.consecutiveFailures());
        }
        return FailureRecord.CLEAN;
    }

    /**
     * Records a failed probe: increments the counter, stamps the failure time, and opens the
     * breaker once the threshold is reached. Applies regardless of the current breaker state.
     *
     * @param component The component name.
     * @return The updated record.
     */
    public FailureRecord recordFailure(String component) {
        Instant now = clock.instant();
        BreakerState[] previousState = new BreakerState[1];
        FailureRecord updated = records.compute(component, (name, current) -> {
            FailureRecord record = current == null ? FailureRecord.CLEAN : current;
            previousState[0] = record.state();
            int failures = record.consecutiveFailures() + 1;
            BreakerState state = failures >= failureThreshold ? BreakerState.OPEN : BreakerState.CLOSED;
            return new FailureRecord(failures, now, state);
        });
        if (previousState[0] == BreakerState.CLOSED && updated.state() == BreakerState.OPEN) {
            log.warn("Circuit for '{}' opened after {} consecutive failures, skipping probes for {}s",
                component, updated.consecutiveFailures(), cooldown.toSeconds());
        }
        return updated;
    }

    /**
     * Returns the current record of a component, a clean record if it never failed.
     */
    public FailureRecord getRecord(String component) {
        return records.getOrDefault(component, FailureRecord.CLEAN);
    }

    /**
     * Returns the effective breaker state, taking an elapsed cooldown into account without
     * mutating the stored record.
     */
    public BreakerState getState(String component) {
        FailureRecord record = getRecord(component);
        if (record.state() == BreakerState.OPEN && cooldownElapsed(record, clock.instant())) {
            return BreakerState.CLOSED;
        }
        return record.state();
    }

    /**
     * Forgets the history of a component, closing its breaker.
     *
     * @param component The component name.
     */
    public void reset(String component) {
        records.remove(component);
        log.info("Failure history of '{}' reset", component);
    }

    /**
     * Counts components whose breaker is effectively open right now.
     */
    public int openCount() {
        int open = 0;
        for (String component : records.keySet()) {
            if (getState(component) == BreakerState.OPEN) {
                open++;
            }
        }
        return open;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public Duration getCooldown() {
        return cooldown;
    }

    private boolean cooldownElapsed(FailureRecord record, Instant now) {
        return record.lastFailureAt() == null
            || Duration.between(record.lastFailureAt(), now).compareTo(cooldown) >= 0;
    }
}
