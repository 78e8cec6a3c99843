package org.pulsecheck.monitor.probes;

import com.typesafe.config.ConfigFactory;
import org.pulsecheck.monitor.api.probes.ProbeOutcome;
import org.pulsecheck.monitor.api.report.HealthStatus;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class ThreadLivenessProbeTest {

    @Test
    void currentJvmHasNoDeadlocks() {
        ProbeOutcome outcome = new ThreadLivenessProbe("background_tasks", ConfigFactory.empty()).probe();

        assertThat(outcome).isInstanceOf(ProbeOutcome.Success.class);
        assertThat(((ProbeOutcome.Success) outcome).detail()).containsKey("live_threads");
    }

    @Test
    void deadlockedThreadsFailTheProbe() {
        ThreadMXBean threads = mock(ThreadMXBean.class);
        ThreadInfo worker = mock(ThreadInfo.class);
        when(worker.getThreadName()).thenReturn("worker-1");
        when(threads.getThreadCount()).thenReturn(12);
        when(threads.findDeadlockedThreads()).thenReturn(new long[]{42L});
        when(threads.getThreadInfo(new long[]{42L})).thenReturn(new ThreadInfo[]{worker});

        ProbeOutcome outcome = new ThreadLivenessProbe("background_tasks", ConfigFactory.empty(), threads).probe();

        assertThat(outcome).isInstanceOf(ProbeOutcome.Failure.class);
        assertThat(((ProbeOutcome.Failure) outcome).message()).isEqualTo("1 deadlocked threads: worker-1");
    }

    @Test
    void tooManyThreadsIsDegraded() {
        ThreadMXBean threads = mock(ThreadMXBean.class);
        when(threads.getThreadCount()).thenReturn(150);

        ProbeOutcome outcome = new ThreadLivenessProbe("background_tasks",
            ConfigFactory.parseMap(Map.of("max-threads", 100)), threads).probe();

        assertThat(((ProbeOutcome.Success) outcome).statusHint()).isEqualTo(HealthStatus.DEGRADED);
    }
}
