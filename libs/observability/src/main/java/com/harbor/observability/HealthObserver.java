package com.harbor.observability;

/**
 * Receives the outcome of every completed dependency check, typically to record a metric.
 */
@FunctionalInterface
public interface HealthObserver {

    /** Observer that ignores every observation. */
    HealthObserver NONE = (name, healthy) -> { };

    void observeHealth(String name, boolean healthy);
}
