package com.harbor.server.metrics;

import com.harbor.observability.MetricFactory;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.web.HttpRequestHandler;

/**
 * {@link Recorder} backed by a Prometheus meter registry.
 * <p>
 * Emits, under the configured namespace:
 * <ul>
 *   <li>{@code http.request.duration} timer, tagged {@code method}, {@code path}, {@code code}</li>
 *   <li>{@code http.response.size} summary in bytes, same tags</li>
 *   <li>{@code health.status} gauge per {@code dependency}, 1 when healthy and 0 otherwise</li>
 * </ul>
 */
public class MicrometerRecorder implements Recorder {

    static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final PrometheusMeterRegistry registry;
    private final MetricFactory metrics;
    private final boolean groupStatusCodes;
    private final Map<String, AtomicLong> healthGauges = new ConcurrentHashMap<>();

    public MicrometerRecorder(PrometheusMeterRegistry registry, String namespace, boolean groupStatusCodes) {
        this.registry = registry;
        this.metrics = new MetricFactory(registry, namespace);
        this.groupStatusCodes = groupStatusCodes;
    }

    @Override
    public HttpRequestHandler handler() {
        return (request, response) -> {
            byte[] body = registry.scrape().getBytes(StandardCharsets.UTF_8);
            response.setStatus(200);
            response.setContentType(CONTENT_TYPE);
            response.setContentLength(body.length);
            response.getOutputStream().write(body);
        };
    }

    @Override
    public void observeRequestDuration(String method, String path, int statusCode, Duration duration) {
        metrics.timer("http.request.duration", "Time taken to serve HTTP requests",
                        "method", method, "path", path, "code", code(statusCode))
                .record(duration);
    }

    @Override
    public void observeResponseSize(String method, String path, int statusCode, long bytes) {
        metrics.distributionSummary("http.response.size", "Size of HTTP response bodies", "bytes",
                        "method", method, "path", path, "code", code(statusCode))
                .record(bytes);
    }

    @Override
    public void observeHealth(String name, boolean healthy) {
        healthGauges
                .computeIfAbsent(name, dependency -> metrics.gauge("health.status",
                        "Health of a dependency, 1 healthy and 0 unhealthy", "dependency", dependency))
                .set(healthy ? 1 : 0);
    }

    private String code(int statusCode) {
        if (groupStatusCodes && statusCode >= 100 && statusCode < 600) {
            return (statusCode / 100) + "xx";
        }
        return Integer.toString(statusCode);
    }
}
