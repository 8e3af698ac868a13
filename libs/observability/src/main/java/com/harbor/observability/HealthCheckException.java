package com.harbor.observability;

/**
 * Failure thrown by a {@link HealthChecker} that wants to report structured detail.
 * <p>
 * When {@link #details()} serializes to a non-empty JSON value it is reported as-is;
 * otherwise the exception message is reported as text.
 */
public class HealthCheckException extends Exception {

    private final transient Object details;

    public HealthCheckException(String message) {
        this(message, null, null);
    }

    public HealthCheckException(String message, Object details) {
        this(message, details, null);
    }

    public HealthCheckException(String message, Object details, Throwable cause) {
        super(message, cause);
        this.details = details;
    }

    /**
     * Returns the structured detail for this failure, or {@code null}.
     */
    public Object details() {
        return details;
    }
}
