package com.harbor.server.config;

import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the Harbor server, bound from {@code harbor.server.*}.
 *
 * <pre>
 * harbor:
 *   server:
 *     version: 1.4.2
 *     read-correlation-header: true
 *     metrics-namespace: harbor
 *     group-status-codes: false
 * </pre>
 *
 * @param version               version string reported by /version and /health; {@code null} when unset
 * @param readCorrelationHeader adopt an inbound {@code Correlation-ID} header instead of always generating one
 * @param metricsNamespace      prefix for every emitted metric (default {@code harbor})
 * @param groupStatusCodes      record status codes as {@code 2xx}/{@code 4xx}/{@code 5xx} classes
 */
@ConfigurationProperties(prefix = "harbor.server")
@Validated
public record HarborServerProperties(
        String version,
        boolean readCorrelationHeader,
        @Pattern(regexp = "[a-zA-Z][a-zA-Z0-9_.]*") String metricsNamespace,
        boolean groupStatusCodes) {

    public static final String DEFAULT_METRICS_NAMESPACE = "harbor";

    /**
     * Compact constructor: applies defaults for optional fields before Bean Validation runs.
     */
    public HarborServerProperties {
        if (version != null && version.isBlank()) {
            version = null;
        }
        if (metricsNamespace == null || metricsNamespace.isBlank()) {
            metricsNamespace = DEFAULT_METRICS_NAMESPACE;
        }
    }
}
