package com.harbor.server.metrics;

import java.time.Duration;
import org.springframework.web.HttpRequestHandler;

/** Records nothing; /metrics answers an empty 200. */
public final class NoOpRecorder implements Recorder {

    @Override
    public HttpRequestHandler handler() {
        return (request, response) -> response.setStatus(200);
    }

    @Override
    public void observeRequestDuration(String method, String path, int statusCode, Duration duration) {
    }

    @Override
    public void observeResponseSize(String method, String path, int statusCode, long bytes) {
    }

    @Override
    public void observeHealth(String name, boolean healthy) {
    }
}
