package org.pulsecheck.monitor.api.report;

/**
 * Policy tier that controls how much a component's failure affects the overall verdict.
 */
public enum Priority {
    CRITICAL(3),
    IMPORTANT(2),
    OPTIONAL(1);

    private final int weight;

    Priority(int weight) {
        this.weight = weight;
    }

    /**
     * Weight of a component of this tier in the overall health score.
     */
    public int weight() {
        return weight;
    }
}
