package com.harbor.observability;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for creating Micrometer metrics under a common namespace.
 * <p>
 * Every metric name is prefixed with the namespace ({@code harbor.http.request.duration} for
 * namespace {@code harbor}), which the Prometheus registry renders as
 * {@code harbor_http_request_duration_seconds}. Meters are looked up by name and tags, so
 * asking twice for the same meter returns the existing one.
 */
public final class MetricFactory {

    /** Upper bound of the summary histogram buckets (1 GiB for byte sizes). */
    public static final double MAX_SUMMARY_VALUE = 1024d * 1024 * 1024;

    private final MeterRegistry registry;
    private final String namespace;

    /**
     * Creates a MetricFactory bound to the given registry and namespace.
     *
     * @param registry  the Micrometer meter registry (e.g., PrometheusMeterRegistry)
     * @param namespace prefix for every metric name
     */
    public MetricFactory(MeterRegistry registry, String namespace) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be null or blank");
        }
        this.registry = registry;
        this.namespace = namespace;
    }

    /**
     * Creates or looks up a timer (histogram of durations).
     * <p>
     * Publishes histogram buckets so quantiles can be computed from a scrape.
     *
     * @param name        metric name without namespace (e.g., "http.request.duration")
     * @param description human-readable description
     * @param tags        tags as key-value pairs
     * @return the timer
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(qualify(name))
                .description(description)
                .publishPercentileHistogram()
                .tags(Tags.of(tags))
                .register(registry);
    }

    /**
     * Creates or looks up a distribution summary, with histogram buckets up to
     * {@link #MAX_SUMMARY_VALUE}.
     *
     * @param name        metric name without namespace (e.g., "http.response.size")
     * @param description human-readable description
     * @param baseUnit    unit of the recorded values (e.g., "bytes")
     * @param tags        tags as key-value pairs
     * @return the distribution summary
     */
    public DistributionSummary distributionSummary(String name, String description, String baseUnit,
                                                   String... tags) {
        return DistributionSummary.builder(qualify(name))
                .description(description)
                .baseUnit(baseUnit)
                .publishPercentileHistogram()
                .maximumExpectedValue(MAX_SUMMARY_VALUE)
                .tags(Tags.of(tags))
                .register(registry);
    }

    /**
     * Registers a gauge backed by a returned {@link AtomicLong}.
     * <p>
     * The caller must keep the returned value reachable; Micrometer only holds it weakly.
     *
     * @param name        metric name without namespace (e.g., "health.status")
     * @param description human-readable description
     * @param tags        tags as key-value pairs
     * @return an AtomicLong that can be used to update the gauge value
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(qualify(name), value, AtomicLong::doubleValue)
                .description(description)
                .tags(Tags.of(tags))
                .register(registry);
        return value;
    }

    /**
     * Returns the namespace prefixed to every metric name.
     */
    public String namespace() {
        return namespace;
    }

    private String qualify(String name) {
        return namespace + "." + name;
    }
}
