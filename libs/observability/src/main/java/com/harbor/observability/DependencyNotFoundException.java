package com.harbor.observability;

/**
 * Thrown when a health check is requested for a dependency name that was never registered.
 */
public class DependencyNotFoundException extends RuntimeException {

    private final String name;

    public DependencyNotFoundException(String name) {
        super("no health dependency registered as '" + name + "'");
        this.name = name;
    }

    public String name() {
        return name;
    }
}
