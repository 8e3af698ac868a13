package com.harbor.observability;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health status for a single dependency or the aggregate server.
 * <p>
 * There is no degraded state: one unhealthy dependency makes the aggregate unhealthy.
 */
public enum HealthStatus {

    /** The dependency answered its check without error. */
    HEALTHY("healthy"),

    /** The dependency failed its check, or the check was cancelled. */
    UNHEALTHY("unhealthy");

    private final String label;

    HealthStatus(String label) {
        this.label = label;
    }

    /**
     * Returns the lower-case wire label ({@code healthy} / {@code unhealthy}).
     */
    @JsonValue
    public String label() {
        return label;
    }
}
