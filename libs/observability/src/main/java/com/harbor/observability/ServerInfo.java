package com.harbor.observability;

import java.time.Duration;

/**
 * Server-level facts included in aggregate health results.
 */
public interface ServerInfo {

    /**
     * Returns the configured server version, or {@code null} when unversioned.
     */
    String version();

    /**
     * Returns how long the server has been running, {@link Duration#ZERO} when stopped.
     */
    Duration uptime();
}
