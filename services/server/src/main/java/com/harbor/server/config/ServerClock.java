package com.harbor.server.config;

import com.harbor.observability.ServerInfo;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import org.springframework.context.SmartLifecycle;

/**
 * Tracks when the server started, for the uptime reported by /health.
 * <p>
 * Started and stopped with the application context. Uptime is zero before start and after stop.
 */
public class ServerClock implements SmartLifecycle, ServerInfo {

    private final String version;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private Instant startedAt;

    public ServerClock(String version, Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.version = version;
        this.clock = clock;
    }

    @Override
    public void start() {
        lock.lock();
        try {
            startedAt = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void stop() {
        lock.lock();
        try {
            startedAt = null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isRunning() {
        lock.lock();
        try {
            return startedAt != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public Duration uptime() {
        lock.lock();
        try {
            if (startedAt == null) {
                return Duration.ZERO;
            }
            Duration elapsed = Duration.between(startedAt, clock.instant());
            return elapsed.isNegative() ? Duration.ZERO : elapsed;
        } finally {
            lock.unlock();
        }
    }
}
