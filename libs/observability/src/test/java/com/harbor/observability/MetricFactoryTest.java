package com.harbor.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MetricFactory}: validates namespacing, tags, and meter reuse.
 */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "harbor");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "harbor"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank namespace")
        void shouldRejectBlankNamespace() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("namespace");
        }
    }

    @Test
    @DisplayName("should publish histogram buckets for timers and summaries")
    void shouldPublishHistograms() {
        Timer timer = factory.timer("http.request.duration", "Request duration", "method", "GET");
        DistributionSummary summary =
                factory.distributionSummary("http.response.size", "Response size", "bytes", "method", "GET");

        timer.record(Duration.ofMillis(20));
        summary.record(512);

        assertThat(timer.takeSnapshot().histogramCounts()).isNotEmpty();
        assertThat(summary.takeSnapshot().histogramCounts()).isNotEmpty()
                .allSatisfy(bucket -> assertThat(bucket.bucket()).isLessThanOrEqualTo(MetricFactory.MAX_SUMMARY_VALUE));
    }

    @Test
    @DisplayName("should return the same timer for the same name and tags")
    void shouldReuseTimer() {
        Timer first = factory.timer("http.request.duration", "Request duration", "method", "GET");
        Timer second = factory.timer("http.request.duration", "Request duration", "method", "GET");

        first.record(Duration.ofMillis(150));
        second.record(Duration.ofMillis(250));

        assertThat(second).isSameAs(first);
        assertThat(first.count()).isEqualTo(2);
        assertThat(first.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(400.0);
    }

    @Test
    @DisplayName("should create distribution summary with base unit")
    void shouldCreateDistributionSummary() {
        DistributionSummary summary =
                factory.distributionSummary("http.response.size", "Response size", "bytes", "code", "200");

        summary.record(1024);
        summary.record(2048);

        assertThat(summary.count()).isEqualTo(2);
        assertThat(summary.totalAmount()).isEqualTo(3072.0);
        assertThat(summary.getId().getBaseUnit()).isEqualTo("bytes");
        assertThat(summary.getId().getName()).isEqualTo("harbor.http.response.size");
    }

    @Test
    @DisplayName("should update gauge value dynamically")
    void shouldUpdateGaugeDynamically() {
        AtomicLong value = factory.gauge("health.status", "Dependency health", "dependency", "db");

        value.set(1);
        assertThat(registry.get("harbor.health.status").tag("dependency", "db").gauge().value())
                .isEqualTo(1.0);

        value.set(0);
        assertThat(registry.get("harbor.health.status").tag("dependency", "db").gauge().value())
                .isEqualTo(0.0);
    }
}
