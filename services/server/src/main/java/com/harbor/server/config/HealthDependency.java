package com.harbor.server.config;

import com.harbor.observability.HealthChecker;

/**
 * A named dependency checked by /health. Declare one bean per dependency; when two share a
 * name the later one wins.
 *
 * @param name    dependency name, reported as the key under {@code services}
 * @param checker the check to run
 */
public record HealthDependency(String name, HealthChecker checker) {

    public HealthDependency {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (checker == null) {
            throw new IllegalArgumentException("checker must not be null");
        }
    }
}
