package com.harbor.server.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("MicrometerRecorder")
class MicrometerRecorderTest {

    private PrometheusMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }

    @Test
    @DisplayName("records request duration tagged by method, path and code")
    void recordsDuration() {
        var recorder = new MicrometerRecorder(registry, "harbor", false);

        recorder.observeRequestDuration("GET", "/health/{name}", 200, Duration.ofMillis(250));
        recorder.observeRequestDuration("GET", "/health/{name}", 200, Duration.ofMillis(50));

        var timer = registry.get("harbor.http.request.duration")
                .tags("method", "GET", "path", "/health/{name}", "code", "200")
                .timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(300.0);
    }

    @Test
    @DisplayName("records response size in bytes")
    void recordsSize() {
        var recorder = new MicrometerRecorder(registry, "harbor", false);

        recorder.observeResponseSize("GET", "/ping", 200, 4);

        var summary = registry.get("harbor.http.response.size").tags("code", "200").summary();
        assertThat(summary.totalAmount()).isEqualTo(4.0);
        assertThat(summary.getId().getBaseUnit()).isEqualTo("bytes");
    }

    @Test
    @DisplayName("groups status codes into classes when enabled")
    void groupsStatusCodes() {
        var recorder = new MicrometerRecorder(registry, "harbor", true);

        recorder.observeRequestDuration("GET", "/health", 500, Duration.ofMillis(1));
        recorder.observeRequestDuration("GET", "/health", 503, Duration.ofMillis(1));

        assertThat(registry.get("harbor.http.request.duration").tags("code", "5xx").timer().count())
                .isEqualTo(2);
    }

    @Test
    @DisplayName("tracks dependency health as a 1/0 gauge")
    void tracksHealthGauge() {
        var recorder = new MicrometerRecorder(registry, "harbor", false);

        recorder.observeHealth("queue", true);
        assertThat(registry.get("harbor.health.status").tags("dependency", "queue").gauge().value())
                .isEqualTo(1.0);

        recorder.observeHealth("queue", false);
        assertThat(registry.get("harbor.health.status").tags("dependency", "queue").gauge().value())
                .isEqualTo(0.0);
    }

    @Test
    @DisplayName("uses the configured namespace")
    void usesNamespace() {
        var recorder = new MicrometerRecorder(registry, "orders", false);

        recorder.observeHealth("db", true);

        assertThat(registry.find("orders.health.status").gauge()).isNotNull();
        assertThat(registry.find("harbor.health.status").gauge()).isNull();
    }

    @Test
    @DisplayName("handler serves the Prometheus text exposition")
    void handlerServesScrape() throws Exception {
        var recorder = new MicrometerRecorder(registry, "harbor", false);
        recorder.observeRequestDuration("GET", "/ping", 200, Duration.ofMillis(3));
        recorder.observeResponseSize("GET", "/ping", 200, 4);
        var response = new MockHttpServletResponse();

        recorder.handler().handleRequest(new MockHttpServletRequest("GET", "/metrics"), response);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getContentType()).startsWith("text/plain").contains("version=0.0.4");
        assertThat(response.getContentAsString())
                .contains("harbor_http_request_duration_seconds_count")
                .contains("harbor_http_request_duration_seconds_bucket")
                .contains("harbor_http_response_size_bytes_bucket")
                .contains("path=\"/ping\"");
    }
}
