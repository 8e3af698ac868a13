package com.harbor.observability;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate health of the server and all registered dependencies.
 *
 * @param status   {@link HealthStatus#UNHEALTHY} if any dependency is unhealthy
 * @param version  server version, {@code null} when not configured
 * @param uptime   whole seconds since the server started, 0 when it is not running
 * @param services per-dependency results keyed by name, sorted by name
 */
@JsonPropertyOrder({"status", "version", "uptime", "services"})
public record AggregateResult(
        HealthStatus status,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String version,
        long uptime,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, ServiceHealth> services
) {

    public AggregateResult {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        services = Collections.unmodifiableMap(new TreeMap<>(services));
    }

    @JsonIgnore
    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
