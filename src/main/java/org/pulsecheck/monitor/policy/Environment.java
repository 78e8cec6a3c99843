package org.pulsecheck.monitor.policy;

import java.util.Locale;

/**
 * Deployment environment tiers that drive priority classification.
 */
public enum Environment {
    DEVELOPMENT,
    TESTING,
    STAGING,
    PRODUCTION;

    /**
     * Resolves an environment name as supplied by the caller.
     * <p>
     * Matching is case-insensitive and accepts common short forms. Anything unrecognised,
     * including {@code null}, is treated as {@link #DEVELOPMENT}.
     *
     * @param name The environment name, e.g. "production" or "prod".
     * @return The matching tier.
     */
    public static Environment fromName(String name) {
        if (name == null) {
            return DEVELOPMENT;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "production", "prod" -> PRODUCTION;
            case "staging", "stage" -> STAGING;
            case "testing", "test" -> TESTING;
            default -> DEVELOPMENT;
        };
    }
}
