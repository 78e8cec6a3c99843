package org.pulsecheck.monitor.probes;

import com.typesafe.config.Config;
import org.pulsecheck.monitor.api.probes.AbstractProbe;
import org.pulsecheck.monitor.api.probes.ProbeOutcome;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the liveness of the JVM's background work: fails on deadlocked threads and
 * reports degraded when the live thread count exceeds {@code max-threads} (default 2000).
 */
public class ThreadLivenessProbe extends AbstractProbe {

    private final ThreadMXBean threads;

    public ThreadLivenessProbe(String name, Config options) {
        this(name, options, ManagementFactory.getThreadMXBean());
    }

    ThreadLivenessProbe(String name, Config options, ThreadMXBean threads) {
        super(name, options);
        this.threads = threads;
    }

    @Override
    protected Map<String, Object> defaults() {
        return Map.of("max-threads", 2000);
    }

    @Override
    public ProbeOutcome probe() {
        Map<String, Object> detail = new LinkedHashMap<>();
        int live = threads.getThreadCount();
        detail.put("live_threads", live);
        detail.put("daemon_threads", threads.getDaemonThreadCount());

        long[] deadlocked = threads.findDeadlockedThreads();
        if (deadlocked != null && deadlocked.length > 0) {
            List<String> names = new ArrayList<>();
            for (ThreadInfo info : threads.getThreadInfo(deadlocked)) {
                if (info != null) {
                    names.add(info.getThreadName());
                }
            }
            detail.put("deadlocked_threads", names);
            return ProbeOutcome.failure(deadlocked.length + " deadlocked threads: " + String.join(", ", names), detail);
        }
        if (live > options.getInt("max-threads")) {
            return ProbeOutcome.degraded(detail);
        }
        return ProbeOutcome.healthy(detail);
    }
}
