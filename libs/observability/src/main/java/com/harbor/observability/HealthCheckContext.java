package com.harbor.observability;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-request context handed to every {@link HealthChecker} of one health pass.
 * <p>
 * Cancellation is cooperative: the aggregator flips the flag (and interrupts its workers) when
 * the waiting request thread is interrupted, but a checker only stops early if it looks.
 */
public final class HealthCheckContext {

    private final CorrelationContext correlation;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private HealthCheckContext(CorrelationContext correlation) {
        this.correlation = correlation;
    }

    /**
     * Creates a context bound to the current thread's correlation, if any.
     */
    public static HealthCheckContext current() {
        return new HealthCheckContext(CorrelationContextHolder.get().orElse(null));
    }

    /**
     * Creates a context with no correlation (startup probes, tests).
     */
    public static HealthCheckContext background() {
        return new HealthCheckContext(null);
    }

    /**
     * Creates a context bound to the given correlation.
     */
    public static HealthCheckContext of(CorrelationContext correlation) {
        if (correlation == null) {
            throw new IllegalArgumentException("correlation must not be null");
        }
        return new HealthCheckContext(correlation);
    }

    public Optional<CorrelationContext> correlation() {
        return Optional.ofNullable(correlation);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Marks this context cancelled. Idempotent.
     */
    public void cancel() {
        cancelled.set(true);
    }
}
