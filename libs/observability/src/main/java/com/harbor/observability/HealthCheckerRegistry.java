package com.harbor.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Registry of named {@link HealthChecker} instances, filled while the server is configured.
 * <p>
 * Registering a name twice replaces the earlier checker (last write wins). Once traffic is
 * served the registry is only read, through the snapshot a {@link HealthAggregator} takes at
 * construction.
 */
public final class HealthCheckerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckerRegistry.class);

    private final Map<String, HealthChecker> checkers = new LinkedHashMap<>();

    /**
     * Registers a health checker under the given dependency name.
     * Replaces any existing checker for the same name.
     *
     * @param name    dependency name (e.g., "postgres", "redis")
     * @param checker the health checker to register
     */
    public synchronized void register(String name, HealthChecker checker) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (checker == null) {
            throw new IllegalArgumentException("checker must not be null");
        }
        if (checkers.put(name, checker) != null) {
            log.debug("Replaced health dependency {}", name);
        } else {
            log.debug("Registered health dependency {}", name);
        }
    }

    /**
     * Returns an immutable copy of the current registrations.
     */
    public synchronized Map<String, HealthChecker> snapshot() {
        return Map.copyOf(checkers);
    }

    /**
     * Returns the registered dependency names.
     */
    public synchronized Set<String> names() {
        return Set.copyOf(checkers.keySet());
    }

    /**
     * Returns the number of registered health checkers.
     */
    public synchronized int size() {
        return checkers.size();
    }
}
