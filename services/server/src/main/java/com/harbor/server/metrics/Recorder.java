package com.harbor.server.metrics;

import com.harbor.observability.HealthObserver;
import java.time.Duration;
import org.springframework.web.HttpRequestHandler;

/**
 * Sink for the server's request and health metrics.
 * <p>
 * Implementations must be safe for concurrent use: every request thread and every health check
 * worker reports here.
 */
public interface Recorder extends HealthObserver {

    /**
     * Handler serving the recorded metrics, mounted at /metrics.
     */
    HttpRequestHandler handler();

    /**
     * Records how long a request took.
     *
     * @param method     HTTP method
     * @param path       route template, or the raw path when no route matched
     * @param statusCode final response status
     * @param duration   wall time from filter entry to completion
     */
    void observeRequestDuration(String method, String path, int statusCode, Duration duration);

    /**
     * Records how many body bytes a request wrote.
     */
    void observeResponseSize(String method, String path, int statusCode, long bytes);
}
