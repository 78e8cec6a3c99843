package org.pulsecheck.monitor.policy;

import org.pulsecheck.monitor.api.report.ComponentResult;
import org.pulsecheck.monitor.api.report.HealthStatus;
import org.pulsecheck.monitor.api.report.Priority;
import org.pulsecheck.monitor.api.report.StatusBreakdown;

import java.util.List;

/**
 * Folds component results into the overall score and status.
 * <p>
 * The overall status is priority-first rather than score-based, so a single critical outage
 * can never be averaged away by many healthy optional components:
 * <ol>
 *   <li>Any CRITICAL component UNHEALTHY or CIRCUIT_OPEN → UNHEALTHY</li>
 *   <li>Otherwise any CRITICAL or IMPORTANT component not HEALTHY → DEGRADED</li>
 *   <li>Otherwise → HEALTHY</li>
 * </ol>
 * The weighted score uses the weights of {@link Priority} (3/2/1).
 */
public final class HealthScoreAggregator {

    static final double UNHEALTHY_RATIO_THRESHOLD = 0.5;
    static final double DEGRADED_RATIO_THRESHOLD = 0.3;

    private HealthScoreAggregator() {
    }

    /**
     * Computes the weighted mean of the score contributions.
     *
     * @param results The component results of one cycle, must not be empty.
     * @return The score in [0, 1].
     */
    public static double weightedScore(List<ComponentResult> results) {
        requireNonEmpty(results);
        double weightedSum = 0.0;
        int totalWeight = 0;
        for (ComponentResult result : results) {
            int weight = result.priority().weight();
            weightedSum += weight * result.scoreContribution();
            totalWeight += weight;
        }
        double score = weightedSum / totalWeight;
        return Math.max(0.0, Math.min(1.0, score));
    }

    /**
     * Derives the priority-first overall status.
     *
     * @param results The component results of one cycle, must not be empty.
     * @return HEALTHY, DEGRADED or UNHEALTHY.
     */
    public static HealthStatus overallStatus(List<ComponentResult> results) {
        requireNonEmpty(results);
        boolean degraded = false;
        for (ComponentResult result : results) {
            if (result.priority() == Priority.OPTIONAL) {
                continue;
            }
            HealthStatus status = result.status();
            if (result.priority() == Priority.CRITICAL && status.isUnhealthyEquivalent()) {
                return HealthStatus.UNHEALTHY;
            }
            if (status != HealthStatus.HEALTHY) {
                degraded = true;
            }
        }
        return degraded ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
    }

    /**
     * Computes the count-based secondary view.
     * <p>
     * {@code simpleScore = (healthy + 0.5 * degraded) / total}; more than half unhealthy is
     * UNHEALTHY, any unhealthy or more than 30% degraded is DEGRADED.
     *
     * @param results The component results of one cycle.
     * @return The breakdown, all zero with status UNKNOWN for an empty list.
     */
    public static StatusBreakdown breakdown(List<ComponentResult> results) {
        int healthy = 0;
        int degraded = 0;
        int unhealthy = 0;
        int circuitOpen = 0;
        int unknown = 0;
        for (ComponentResult result : results) {
            switch (result.status()) {
                case HEALTHY -> healthy++;
                case DEGRADED -> degraded++;
                case UNHEALTHY -> unhealthy++;
                case CIRCUIT_OPEN -> {
                    unhealthy++;
                    circuitOpen++;
                }
                case UNKNOWN -> unknown++;
            }
        }
        int total = results.size();
        if (total == 0) {
            return new StatusBreakdown(0, 0, 0, 0, 0, 0, 0.0, HealthStatus.UNKNOWN);
        }

        double simpleScore = (healthy + 0.5 * degraded) / total;
        HealthStatus simpleStatus;
        if ((double) unhealthy / total > UNHEALTHY_RATIO_THRESHOLD) {
            simpleStatus = HealthStatus.UNHEALTHY;
        } else if (unhealthy > 0 || (double) degraded / total > DEGRADED_RATIO_THRESHOLD) {
            simpleStatus = HealthStatus.DEGRADED;
        } else {
            simpleStatus = HealthStatus.HEALTHY;
        }
        return new StatusBreakdown(healthy, degraded, unhealthy, circuitOpen, unknown, total, simpleScore, simpleStatus);
    }

    private static void requireNonEmpty(List<ComponentResult> results) {
        if (results == null || results.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty list of component results");
        }
    }
}
