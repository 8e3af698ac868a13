package com.harbor.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs dependency health checks and reduces them into one {@link AggregateResult}.
 * <p>
 * {@link #checkAll(HealthCheckContext)} fans every registered checker out to its own task and
 * waits for all of them, so a pass takes as long as the slowest dependency. There is no
 * timeout here: callers cancel through the request thread (interruption) and checkers are
 * expected to bound their own work.
 * <p>
 * The set of dependencies is captured when the aggregator is created; later changes to the
 * {@link HealthCheckerRegistry} are not seen.
 */
public final class HealthAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthAggregator.class);

    static final String CANCELLED_MESSAGE = "health check cancelled";

    private final Map<String, HealthChecker> checkers;
    private final HealthObserver observer;
    private final HealthDetailResolver detailResolver;
    private final ServerInfo serverInfo;
    private final ExecutorService executor;

    /**
     * Creates an aggregator with its own cached pool of daemon worker threads.
     */
    public HealthAggregator(HealthCheckerRegistry registry, HealthObserver observer,
                            HealthDetailResolver detailResolver, ServerInfo serverInfo) {
        this(registry, observer, detailResolver, serverInfo,
                Executors.newCachedThreadPool(workerThreadFactory()));
    }

    /**
     * Creates an aggregator running checks on the given executor. The executor is shut down by
     * {@link #close()}.
     */
    public HealthAggregator(HealthCheckerRegistry registry, HealthObserver observer,
                            HealthDetailResolver detailResolver, ServerInfo serverInfo,
                            ExecutorService executor) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (detailResolver == null) {
            throw new IllegalArgumentException("detailResolver must not be null");
        }
        if (serverInfo == null) {
            throw new IllegalArgumentException("serverInfo must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.checkers = registry.snapshot();
        this.observer = observer != null ? observer : HealthObserver.NONE;
        this.detailResolver = detailResolver;
        this.serverInfo = serverInfo;
        this.executor = executor;
    }

    /**
     * Runs every registered check concurrently and aggregates the results.
     * <p>
     * Returns {@link HealthStatus#HEALTHY} with no services when nothing is registered. If the
     * calling thread is interrupted while waiting, the context is cancelled, outstanding checks
     * are cancelled and reported unhealthy, and the interrupt flag is restored.
     *
     * @param context the request-scoped context shared by all checks
     * @return the aggregate health result
     */
    public AggregateResult checkAll(HealthCheckContext context) {
        CompletionService<ServiceHealth> completion = new ExecutorCompletionService<>(executor);
        Map<String, Future<ServiceHealth>> pending = new HashMap<>();
        for (Map.Entry<String, HealthChecker> entry : checkers.entrySet()) {
            String name = entry.getKey();
            HealthChecker checker = entry.getValue();
            pending.put(name, completion.submit(() -> runBound(name, checker, context)));
        }

        Map<String, ServiceHealth> services = new HashMap<>();
        HealthStatus status = HealthStatus.HEALTHY;
        try {
            for (int i = 0; i < pending.size(); i++) {
                ServiceHealth health = completion.take().get();
                services.put(health.name(), health);
                if (!health.isHealthy()) {
                    status = HealthStatus.UNHEALTHY;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            int cancelled = 0;
            for (Map.Entry<String, Future<ServiceHealth>> entry : pending.entrySet()) {
                String name = entry.getKey();
                if (services.containsKey(name)) {
                    continue;
                }
                ServiceHealth health = completedOrNull(entry.getValue());
                if (health == null) {
                    entry.getValue().cancel(true);
                    health = ServiceHealth.unhealthy(name, new HealthDetail.Text(CANCELLED_MESSAGE));
                    cancelled++;
                }
                services.put(name, health);
                if (!health.isHealthy()) {
                    status = HealthStatus.UNHEALTHY;
                }
            }
            log.warn("Health check interrupted, cancelled {} of {} dependencies", cancelled, pending.size());
        } catch (ExecutionException e) {
            pending.values().forEach(future -> future.cancel(true));
            throw new IllegalStateException("Health check worker failed", e.getCause());
        }

        return new AggregateResult(status, serverInfo.version(), uptimeSeconds(), services);
    }

    /**
     * Runs a single dependency's check on the calling thread.
     *
     * @param context the request-scoped context
     * @param name    registered dependency name
     * @return the dependency's health
     * @throws DependencyNotFoundException if no dependency is registered under {@code name}
     */
    public ServiceHealth checkOne(HealthCheckContext context, String name) {
        HealthChecker checker = name != null ? checkers.get(name) : null;
        if (checker == null) {
            throw new DependencyNotFoundException(name);
        }
        return runCheck(name, checker, context);
    }

    /**
     * Returns the names of the dependencies this aggregator checks.
     */
    public Set<String> dependencyNames() {
        return checkers.keySet();
    }

    /**
     * Shuts down the worker executor, interrupting any check still running.
     */
    @Override
    public void close() {
        executor.shutdownNow();
    }

    private ServiceHealth runBound(String name, HealthChecker checker, HealthCheckContext context) {
        return context.correlation()
                .map(correlation -> CorrelationContextHolder.supplyWithContext(
                        correlation, () -> runCheck(name, checker, context)))
                .orElseGet(() -> runCheck(name, checker, context));
    }

    private ServiceHealth runCheck(String name, HealthChecker checker, HealthCheckContext context) {
        ServiceHealth health;
        try {
            Object detail = checker.check(context);
            health = ServiceHealth.healthy(name, detailResolver.fromValue(detail));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            health = ServiceHealth.unhealthy(name, detailResolver.fromError(e));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            health = ServiceHealth.unhealthy(name, detailResolver.fromError(e));
        }

        observer.observeHealth(name, health.isHealthy());
        if (health.isHealthy()) {
            log.debug("Health dependency {} is healthy", name);
        } else {
            log.debug("Health dependency {} is unhealthy: {}", name, health.details());
        }
        return health;
    }

    private long uptimeSeconds() {
        Duration uptime = serverInfo.uptime();
        return uptime != null ? uptime.toSeconds() : 0;
    }

    private static ServiceHealth completedOrNull(Future<ServiceHealth> future) {
        if (!future.isDone() || future.isCancelled()) {
            return null;
        }
        try {
            // Already done, so this does not block.
            return future.get();
        } catch (InterruptedException | ExecutionException e) {
            return null;
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "health-check-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
