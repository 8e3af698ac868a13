package com.harbor.observability;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Health result for a single dependency, created once per check and never reused.
 *
 * @param name    registered dependency name (e.g., "postgres", "redis", "kafka")
 * @param status  health status of this dependency
 * @param details optional detail (error text or structured value); {@code null} when none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "details"})
public record ServiceHealth(@JsonIgnore String name, HealthStatus status, HealthDetail details) {

    public ServiceHealth {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    /** Creates a healthy result, optionally carrying detail reported by the checker. */
    public static ServiceHealth healthy(String name, HealthDetail details) {
        return new ServiceHealth(name, HealthStatus.HEALTHY, details);
    }

    /** Creates an unhealthy result. */
    public static ServiceHealth unhealthy(String name, HealthDetail details) {
        return new ServiceHealth(name, HealthStatus.UNHEALTHY, details);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }

    /**
     * Returns the bare body of the per-dependency endpoint: the detail when present,
     * otherwise the status label.
     */
    public JsonNode toBody() {
        return details != null ? details.toJson() : TextNode.valueOf(status.label());
    }
}
