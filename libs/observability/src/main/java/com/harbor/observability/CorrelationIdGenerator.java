package com.harbor.observability;

import java.util.UUID;

/**
 * Generates fresh correlation IDs for requests that do not bring their own.
 */
@FunctionalInterface
public interface CorrelationIdGenerator {

    String newCorrelationId();

    /**
     * Returns the default generator: a random UUID per call.
     */
    static CorrelationIdGenerator uuid() {
        return () -> UUID.randomUUID().toString();
    }
}
