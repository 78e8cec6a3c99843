package org.pulsecheck.monitor.runner;

import org.pulsecheck.monitor.api.probes.IProbe;
import org.pulsecheck.monitor.api.probes.ProbeOutcome;
import org.pulsecheck.monitor.api.report.ComponentResult;
import org.pulsecheck.monitor.api.report.Priority;
import org.pulsecheck.monitor.breaker.FailureHistory;
import org.pulsecheck.monitor.policy.DegradationPolicy;
import org.pulsecheck.monitor.policy.PriorityClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes all registered probes of one check cycle concurrently and turns every outcome
 * into a {@link ComponentResult}.
 * <p>
 * For each probe, in registration order:
 * <ol>
 *   <li>The priority is resolved for the cycle's environment.</li>
 *   <li>If the component's breaker is open, the probe is not submitted and a CIRCUIT_OPEN
 *       result with zero latency is synthesised.</li>
 *   <li>Otherwise the probe is submitted to the worker pool, wrapped so that any throwable
 *       becomes a {@link ProbeOutcome.Failure} and wall-clock latency is measured.</li>
 * </ol>
 * The runner then joins on every submitted probe. A probe that has not finished within the
 * per-probe timeout (measured from the moment it started running) or before the cycle deadline
 * is cancelled with interruption and recorded as a failure. Every completed, failed, timed-out
 * or cancelled probe updates the {@link FailureHistory}.
 * <p>
 * Results are reassembled by index, so the returned list is always in registration order no
 * matter which probe finished first.
 * <p>
 * <strong>Thread Safety:</strong> {@link #runAll} may be called from several threads; the only
 * shared mutable state it touches is the failure history, which serialises updates per component.
 */
public class CheckRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CheckRunner.class);

    static final String CYCLE_DEADLINE_MESSAGE = "cancelled: cycle deadline exceeded";
    static final String INTERRUPTED_MESSAGE = "cancelled: check interrupted";

    private static final long NO_DEADLINE = -1;

    private final FailureHistory failureHistory;
    private final PriorityClassifier classifier;
    private final DegradationPolicy policy;
    private final Clock clock;
    private final int maxConcurrency;
    private final ExecutorService executor;

    /**
     * @param failureHistory Breaker state shared across cycles.
     * @param classifier     Resolves component priorities.
     * @param policy         Maps outcomes to component results.
     * @param maxConcurrency Maximum number of probes running at the same time.
     * @param clock          Time source for result timestamps.
     */
    public CheckRunner(FailureHistory failureHistory, PriorityClassifier classifier, DegradationPolicy policy,
                       int maxConcurrency, Clock clock) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be positive, got: " + maxConcurrency);
        }
        this.failureHistory = Objects.requireNonNull(failureHistory, "failureHistory");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxConcurrency = maxConcurrency;
        ThreadPoolExecutor pool = new ThreadPoolExecutor(maxConcurrency, maxConcurrency,
            30, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), new ProbeThreadFactory());
        pool.allowCoreThreadTimeOut(true);
        this.executor = pool;
    }

    /**
     * Runs one check cycle.
     *
     * @param probes          Registered probes in registration order.
     * @param environment     Environment name used for priority classification.
     * @param perProbeTimeout Maximum running time of a single probe.
     * @param cycleDeadline   Maximum duration of the whole cycle, {@code null} or zero for none.
     * @return Exactly one result per probe, in the order of {@code probes}.
     */
    public List<ComponentResult> runAll(List<RegisteredProbe> probes, String environment,
                                        Duration perProbeTimeout, Duration cycleDeadline) {
        Objects.requireNonNull(probes, "probes");
        Objects.requireNonNull(perProbeTimeout, "perProbeTimeout");
        if (perProbeTimeout.isNegative() || perProbeTimeout.isZero()) {
            throw new IllegalArgumentException("Per-probe timeout must be positive, got: " + perProbeTimeout);
        }

        int count = probes.size();
        ComponentResult[] results = new ComponentResult[count];
        Priority[] priorities = new Priority[count];
        List<TimedProbe> tasks = new ArrayList<>(count);
        List<Future<TimedOutcome>> futures = new ArrayList<>(count);

        long cycleStart = System.nanoTime();
        long cycleBudgetNanos = (cycleDeadline == null || cycleDeadline.isZero() || cycleDeadline.isNegative())
            ? NO_DEADLINE
            : cycleDeadline.toNanos();

        for (int i = 0; i < count; i++) {
            RegisteredProbe registered = probes.get(i);
            String name = registered.name();
            priorities[i] = classifier.priority(name, environment);

            if (!failureHistory.allowProbe(name)) {
                log.debug("Skipping probe '{}': circuit open", name);
                results[i] = policy.circuitOpen(name, priorities[i], failureHistory.getRecord(name), clock.instant());
                tasks.add(null);
                futures.add(null);
                continue;
            }
            TimedProbe task = new TimedProbe(registered.probe());
            tasks.add(task);
            futures.add(executor.submit(task));
        }

        long waves = Math.max(1, (count + maxConcurrency - 1) / maxConcurrency);
        long queueBudgetNanos = saturatedMultiply(perProbeTimeout.toNanos(), waves);

        boolean interrupted = false;
        for (int i = 0; i < count; i++) {
            Future<TimedOutcome> future = futures.get(i);
            if (future == null) {
                continue;
            }
            String name = probes.get(i).name();
            TimedOutcome timed;
            if (interrupted) {
                timed = afterInterrupt(future, tasks.get(i));
            } else {
                try {
                    timed = await(future, tasks.get(i), perProbeTimeout, cycleStart, cycleBudgetNanos, queueBudgetNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    interrupted = true;
                    log.debug("Check cycle interrupted while waiting for '{}', cancelling pending probes", name);
                    timed = afterInterrupt(future, tasks.get(i));
                }
            }
            results[i] = record(name, priorities[i], timed);
        }

        return List.copyOf(Arrays.asList(results));
    }

    /**
     * Waits for one probe, honouring both its own timeout (from the moment it started) and the
     * cycle deadline. Converts every way the wait can end into an outcome.
     * <p>
     * A probe still queued behind busy workers has not used any of its budget yet. It is only
     * given up on once it has waited longer than every earlier wave of probes could have taken.
     */
    private TimedOutcome await(Future<TimedOutcome> future, TimedProbe task, Duration perProbeTimeout,
                               long cycleStart, long cycleBudgetNanos, long queueBudgetNanos) throws InterruptedException {
        long timeoutNanos = perProbeTimeout.toNanos();
        while (true) {
            if (future.isDone()) {
                return completed(future, task);
            }
            long now = System.nanoTime();
            long cycleRemaining = cycleBudgetNanos == NO_DEADLINE
                ? Long.MAX_VALUE
                : cycleBudgetNanos - (now - cycleStart);
            long probeRemaining = task.hasStarted()
                ? timeoutNanos - (now - task.startedAtNanos())
                : Math.min(timeoutNanos, queueBudgetNanos - (now - task.submittedAtNanos()));

            if (cycleRemaining <= 0) {
                return cancelled(future, task, CYCLE_DEADLINE_MESSAGE);
            }
            if (probeRemaining <= 0 && (task.hasStarted() || now - task.submittedAtNanos() >= queueBudgetNanos)) {
                return cancelled(future, task, "timeout after " + formatSeconds(perProbeTimeout));
            }
            try {
                return future.get(Math.max(1, Math.min(cycleRemaining, probeRemaining)), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                // re-evaluate budgets
            } catch (ExecutionException e) {
                return new TimedOutcome(ProbeOutcome.fromThrowable(e.getCause()), task.elapsedMs());
            } catch (CancellationException e) {
                return new TimedOutcome(ProbeOutcome.failure(INTERRUPTED_MESSAGE), task.elapsedMs());
            }
        }
    }

    private TimedOutcome completed(Future<TimedOutcome> future, TimedProbe task) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            return new TimedOutcome(ProbeOutcome.fromThrowable(e.getCause()), task.elapsedMs());
        } catch (CancellationException e) {
            return new TimedOutcome(ProbeOutcome.failure(INTERRUPTED_MESSAGE), task.elapsedMs());
        }
    }

    private TimedOutcome cancelled(Future<TimedOutcome> future, TimedProbe task, String message) throws InterruptedException {
        if (!future.cancel(true) && future.isDone() && !future.isCancelled()) {
            // finished in the same instant the budget ran out
            return completed(future, task);
        }
        return new TimedOutcome(ProbeOutcome.failure(message), task.elapsedMs());
    }

    /**
     * Resolves a probe once the waiting thread has been interrupted. A probe that already finished
     * keeps its real outcome; only probes still queued or running are cancelled.
     */
    private TimedOutcome afterInterrupt(Future<TimedOutcome> future, TimedProbe task) {
        if (future.isDone() && !future.isCancelled()) {
            try {
                return completed(future, task);
            } catch (InterruptedException e) {
                // a completed future does not block, restore the flag and fall through
                Thread.currentThread().interrupt();
            }
        }
        future.cancel(true);
        return new TimedOutcome(ProbeOutcome.failure(INTERRUPTED_MESSAGE), task.elapsedMs());
    }

    private ComponentResult record(String name, Priority priority, TimedOutcome timed) {
        if (timed.outcome() instanceof ProbeOutcome.Failure failure) {
            failureHistory.recordFailure(name);
            log.warn("Probe '{}' ({}) failed after {}ms: {}", name, priority, Math.round(timed.latencyMs()), failure.message());
        } else {
            failureHistory.recordSuccess(name);
            log.debug("Probe '{}' ({}) succeeded in {}ms", name, priority, Math.round(timed.latencyMs()));
        }
        return policy.assess(name, priority, timed.outcome(), timed.latencyMs(), clock.instant());
    }

    /**
     * Stops the worker pool. Probes still running are interrupted.
     */
    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Probe worker threads did not stop within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for probe workers to stop");
        }
    }

    static String formatSeconds(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 1000 == 0) {
            return (millis / 1000) + "s";
        }
        return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
    }

    private static long saturatedMultiply(long value, long factor) {
        try {
            return Math.multiplyExact(value, factor);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Outcome of one probe together with its measured latency.
     */
    record TimedOutcome(ProbeOutcome outcome, double latencyMs) {
    }

    /**
     * Wraps a probe so that it never throws and records when it started running.
     */
    static final class TimedProbe implements Callable<TimedOutcome> {

        private final IProbe probe;
        private final long submittedAtNanos = System.nanoTime();
        private volatile boolean started;
        private volatile long startedAtNanos;

        TimedProbe(IProbe probe) {
            this.probe = probe;
        }

        @Override
        public TimedOutcome call() {
            long start = System.nanoTime();
            startedAtNanos = start;
            started = true;
            ProbeOutcome outcome;
            try {
                outcome = probe.probe();
                if (outcome == null) {
                    outcome = ProbeOutcome.failure("probe returned no outcome");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcome = ProbeOutcome.failure(INTERRUPTED_MESSAGE);
            } catch (Throwable t) {
                outcome = ProbeOutcome.fromThrowable(t);
            }
            return new TimedOutcome(outcome, (System.nanoTime() - start) / 1_000_000.0);
        }

        boolean hasStarted() {
            return started;
        }

        long startedAtNanos() {
            return startedAtNanos;
        }

        long submittedAtNanos() {
            return submittedAtNanos;
        }

        double elapsedMs() {
            return started ? (System.nanoTime() - startedAtNanos) / 1_000_000.0 : 0.0;
        }
    }

    private static final class ProbeThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pulsecheck-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
