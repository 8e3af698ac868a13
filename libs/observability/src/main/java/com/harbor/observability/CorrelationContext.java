package com.harbor.observability;

/**
 * Immutable correlation context for one inbound request.
 * <p>
 * The correlation ID is either adopted from the {@code Correlation-ID} request header or
 * generated fresh. It is echoed on the response and injected into SLF4J MDC so that every
 * log line written while the request is in flight carries it.
 *
 * @param correlationId opaque identifier for this request's lifecycle
 */
public record CorrelationContext(String correlationId) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * Compact constructor: ensures correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
