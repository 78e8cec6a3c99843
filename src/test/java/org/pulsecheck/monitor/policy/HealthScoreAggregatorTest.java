package org.pulsecheck.monitor.policy;

import org.pulsecheck.monitor.api.report.ComponentResult;
import org.pulsecheck.monitor.api.report.HealthStatus;
import org.pulsecheck.monitor.api.report.Priority;
import org.pulsecheck.monitor.api.report.StatusBreakdown;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class HealthScoreAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private static ComponentResult result(String name, Priority priority, HealthStatus status, double contribution) {
        return new ComponentResult(name, priority, status, contribution, 1.0, NOW, Map.of(), null, List.of());
    }

    @Test
    void allHealthyScoresOne() {
        List<ComponentResult> results = List.of(
            result("db", Priority.CRITICAL, HealthStatus.HEALTHY, 1.0),
            result("cache", Priority.IMPORTANT, HealthStatus.HEALTHY, 1.0),
            result("search", Priority.OPTIONAL, HealthStatus.HEALTHY, 1.0));

        assertThat(HealthScoreAggregator.weightedScore(results)).isEqualTo(1.0);
        assertThat(HealthScoreAggregator.overallStatus(results)).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void weightedScoreUsesPriorityWeights() {
        // (3*1.0 + 2*0.5 + 1*1.0) / 6
        List<ComponentResult> results = List.of(
            result("db", Priority.CRITICAL, HealthStatus.HEALTHY, 1.0),
            result("cache", Priority.IMPORTANT, HealthStatus.DEGRADED, 0.5),
            result("search", Priority.OPTIONAL, HealthStatus.HEALTHY, 1.0));

        assertThat(HealthScoreAggregator.weightedScore(results)).isCloseTo(5.0 / 6.0, within(1e-9));
        assertThat(HealthScoreAggregator.overallStatus(results)).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    void criticalOutageDominatesManyHealthyComponents() {
        List<ComponentResult> results = new ArrayList<>();
        results.add(result("db", Priority.CRITICAL, HealthStatus.UNHEALTHY, 0.0));
        for (int i = 0; i < 50; i++) {
            results.add(result("opt" + i, Priority.OPTIONAL, HealthStatus.HEALTHY, 1.0));
        }

        assertThat(HealthScoreAggregator.overallStatus(results)).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(HealthScoreAggregator.weightedScore(results)).isGreaterThan(0.9);
    }

    @Test
    void openCriticalCircuitIsUnhealthy() {
        List<ComponentResult> results = List.of(
            result("db", Priority.CRITICAL, HealthStatus.CIRCUIT_OPEN, 0.0),
            result("cache", Priority.IMPORTANT, HealthStatus.HEALTHY, 1.0));

        assertThat(HealthScoreAggregator.overallStatus(results)).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void degradedCriticalIsDegradedNotUnhealthy() {
        List<ComponentResult> results = List.of(
            result("db", Priority.CRITICAL, HealthStatus.DEGRADED, 0.5));

        assertThat(HealthScoreAggregator.overallStatus(results)).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    void openImportantCircuitIsDegraded() {
        List<ComponentResult> results = List.of(
            result("db", Priority.CRITICAL, HealthStatus.HEALTHY, 1.0),
            result("cache", Priority.IMPORTANT, HealthStatus.CIRCUIT_OPEN, 0.5));

        assertThat(HealthScoreAggregator.overallStatus(results)).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    void optionalComponentsNeverAffectStatus() {
        List<ComponentResult> results = List.of(
            result("db", Priority.CRITICAL, HealthStatus.HEALTHY, 1.0),
            result("search", Priority.OPTIONAL, HealthStatus.CIRCUIT_OPEN, 1.0));

        assertThat(HealthScoreAggregator.overallStatus(results)).isEqualTo(HealthStatus.HEALTHY);
        assertThat(HealthScoreAggregator.weightedScore(results)).isEqualTo(1.0);
    }

    @Test
    void emptyResultsAreRejected() {
        assertThatThrownBy(() -> HealthScoreAggregator.weightedScore(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HealthScoreAggregator.overallStatus(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void breakdownCountsStatusesAndCircuitOpenAsUnhealthy() {
        StatusBreakdown breakdown = HealthScoreAggregator.breakdown(List.of(
            result("a", Priority.CRITICAL, HealthStatus.HEALTHY, 1.0),
            result("b", Priority.IMPORTANT, HealthStatus.DEGRADED, 0.5),
            result("c", Priority.IMPORTANT, HealthStatus.CIRCUIT_OPEN, 0.5),
            result("d", Priority.OPTIONAL, HealthStatus.HEALTHY, 1.0)));

        assertThat(breakdown.total()).isEqualTo(4);
        assertThat(breakdown.healthy()).isEqualTo(2);
        assertThat(breakdown.degraded()).isEqualTo(1);
        assertThat(breakdown.unhealthy()).isEqualTo(1);
        assertThat(breakdown.circuitOpen()).isEqualTo(1);
        assertThat(breakdown.simpleScore()).isCloseTo(2.5 / 4, within(1e-9));
        assertThat(breakdown.simpleStatus()).isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    void breakdownThresholds() {
        StatusBreakdown mostlyDown = HealthScoreAggregator.breakdown(List.of(
            result("a", Priority.IMPORTANT, HealthStatus.UNHEALTHY, 0.0),
            result("b", Priority.IMPORTANT, HealthStatus.UNHEALTHY, 0.0),
            result("c", Priority.IMPORTANT, HealthStatus.HEALTHY, 1.0)));
        StatusBreakdown fewDegraded = HealthScoreAggregator.breakdown(List.of(
            result("a", Priority.IMPORTANT, HealthStatus.DEGRADED, 0.5),
            result("b", Priority.IMPORTANT, HealthStatus.HEALTHY, 1.0),
            result("c", Priority.IMPORTANT, HealthStatus.HEALTHY, 1.0),
            result("d", Priority.IMPORTANT, HealthStatus.HEALTHY, 1.0)));

        assertThat(mostlyDown.simpleStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(fewDegraded.simpleStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(HealthScoreAggregator.breakdown(List.of()).simpleStatus()).isEqualTo(HealthStatus.UNKNOWN);
    }
}
