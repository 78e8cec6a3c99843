package org.pulsecheck.monitor.policy;

import org.pulsecheck.monitor.api.probes.ProbeOutcome;
import org.pulsecheck.monitor.api.report.ComponentResult;
import org.pulsecheck.monitor.api.report.HealthStatus;
import org.pulsecheck.monitor.api.report.Priority;
import org.pulsecheck.monitor.breaker.BreakerState;
import org.pulsecheck.monitor.breaker.FailureRecord;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DegradationPolicyTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final DegradationPolicy policy = new DegradationPolicy();

    @ParameterizedTest
    @CsvSource({
        "CRITICAL, UNHEALTHY, 0.0",
        "IMPORTANT, DEGRADED, 0.5",
        "OPTIONAL, HEALTHY, 1.0"
    })
    void failureIsMappedByPriority(Priority priority, HealthStatus expectedStatus, double expectedContribution) {
        ComponentResult result = policy.assess("svc", priority, ProbeOutcome.failure("connection refused"), 12.0, NOW);

        assertThat(result.status()).isEqualTo(expectedStatus);
        assertThat(result.scoreContribution()).isEqualTo(expectedContribution);
        assertThat(result.errorMessage()).isEqualTo("connection refused");
        assertThat(result.rootCause()).hasSize(6);
        assertThat(result.latencyMs()).isEqualTo(12.0);
    }

    @ParameterizedTest
    @CsvSource({"CRITICAL", "IMPORTANT", "OPTIONAL"})
    void successIsHealthyForEveryPriority(Priority priority) {
        ComponentResult result = policy.assess("svc", priority, ProbeOutcome.healthy(Map.of("version", "15.2")), 3.0, NOW);

        assertThat(result.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(result.scoreContribution()).isEqualTo(1.0);
        assertThat(result.hasError()).isFalse();
        assertThat(result.rootCause()).isEmpty();
        assertThat(result.detail()).containsEntry("version", "15.2");
    }

    @Test
    void optionalFailureIsMaskedButFlagged() {
        ComponentResult result = policy.assess("search", Priority.OPTIONAL, ProbeOutcome.failure("timeout after 10s"), 10_000.0, NOW);

        assertThat(result.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(result.detail()).containsEntry(DegradationPolicy.OPTIONAL_UNAVAILABLE, true);
        assertThat(result.errorMessage()).isEqualTo("timeout after 10s");
    }

    @Test
    void degradedHintDowngradesRequiredComponents() {
        ComponentResult critical = policy.assess("db", Priority.CRITICAL, ProbeOutcome.degraded(Map.of()), 1.0, NOW);
        ComponentResult optional = policy.assess("search", Priority.OPTIONAL, ProbeOutcome.degraded(Map.of()), 1.0, NOW);

        assertThat(critical.status()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(critical.scoreContribution()).isEqualTo(0.5);
        assertThat(critical.hasError()).isFalse();
        assertThat(optional.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(optional.detail()).containsEntry(DegradationPolicy.OPTIONAL_DEGRADED, true);
    }

    @Test
    void failureDetailIsKept() {
        ComponentResult result = policy.assess("cache", Priority.IMPORTANT,
            ProbeOutcome.failure("refused", Map.of("endpoint", "cache:6379")), 2.0, NOW);

        assertThat(result.detail()).containsEntry("endpoint", "cache:6379");
    }

    @Test
    void circuitOpenResultCarriesFailureRecord() {
        FailureRecord record = new FailureRecord(5, NOW.minusSeconds(30), BreakerState.OPEN);

        ComponentResult result = policy.circuitOpen("db", Priority.CRITICAL, record, NOW);

        assertThat(result.status()).isEqualTo(HealthStatus.CIRCUIT_OPEN);
        assertThat(result.latencyMs()).isZero();
        assertThat(result.scoreContribution()).isZero();
        assertThat(result.errorMessage()).contains("5 consecutive failures");
        assertThat(result.detail())
            .containsEntry("consecutive_failures", 5)
            .containsEntry("last_failure_at", "2024-03-01T11:59:30Z");
        assertThat(result.remediation()).isNotBlank();
    }

    @Test
    void circuitOpenIsScoredLikeFailureOfItsPriority() {
        FailureRecord record = new FailureRecord(5, NOW, BreakerState.OPEN);

        assertThat(policy.circuitOpen("cache", Priority.IMPORTANT, record, NOW).scoreContribution()).isEqualTo(0.5);
        assertThat(policy.circuitOpen("search", Priority.OPTIONAL, record, NOW).scoreContribution()).isEqualTo(1.0);
    }
}
