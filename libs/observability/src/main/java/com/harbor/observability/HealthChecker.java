package com.harbor.observability;

/**
 * Capability a dependency implements to report its own health.
 * <p>
 * Returning normally means healthy; the returned value (may be {@code null}) is reported as
 * detail. Throwing means unhealthy; throw {@link HealthCheckException} to attach structured
 * detail. Implementations should observe {@link HealthCheckContext#isCancelled()} and thread
 * interruption to stop early when the request goes away.
 * <p>
 * Example usage:
 * <pre>{@code
 * HealthChecker postgres = context -> {
 *     try (Connection connection = dataSource.getConnection()) {
 *         if (!connection.isValid(2)) {
 *             throw new HealthCheckException("connection invalid");
 *         }
 *         return null;
 *     }
 * };
 * }</pre>
 */
@FunctionalInterface
public interface HealthChecker {

    /**
     * Checks the dependency once.
     *
     * @param context per-request context carrying correlation and cancellation
     * @return optional detail for a healthy dependency, {@code null} for none
     * @throws Exception if the dependency is unhealthy
     */
    Object check(HealthCheckContext context) throws Exception;
}
