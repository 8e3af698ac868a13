package com.harbor.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.harbor.observability.CorrelationIdGenerator;
import com.harbor.observability.HealthAggregator;
import com.harbor.observability.HealthCheckerRegistry;
import com.harbor.observability.HealthDetailResolver;
import com.harbor.server.metrics.MicrometerRecorder;
import com.harbor.server.metrics.Recorder;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the health engine, metrics and correlation ID generation into the server.
 * <p>
 * {@link Recorder} and {@link CorrelationIdGenerator} are defaults: declaring a bean of either
 * type replaces them.
 */
@Configuration
@EnableConfigurationProperties(HarborServerProperties.class)
public class HarborServerConfig {

    private static final Logger log = LoggerFactory.getLogger(HarborServerConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public PrometheusMeterRegistry prometheusMeterRegistry() {
        return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }

    @Bean
    @ConditionalOnMissingBean(Recorder.class)
    public Recorder recorder(PrometheusMeterRegistry registry, HarborServerProperties properties) {
        return new MicrometerRecorder(registry, properties.metricsNamespace(), properties.groupStatusCodes());
    }

    @Bean
    @ConditionalOnMissingBean
    public CorrelationIdGenerator correlationIdGenerator() {
        return CorrelationIdGenerator.uuid();
    }

    @Bean
    public ServerClock serverClock(HarborServerProperties properties) {
        return new ServerClock(properties.version(), Clock.systemUTC());
    }

    @Bean
    public HealthCheckerRegistry healthCheckerRegistry(ObjectProvider<HealthDependency> dependencies) {
        HealthCheckerRegistry registry = new HealthCheckerRegistry();
        dependencies.orderedStream().forEach(dependency -> registry.register(dependency.name(), dependency.checker()));
        log.info("Health checks configured for {} dependencies: {}", registry.size(), registry.names());
        return registry;
    }

    @Bean
    public HealthAggregator healthAggregator(HealthCheckerRegistry registry, Recorder recorder,
                                             ObjectMapper objectMapper, ServerClock serverClock) {
        return new HealthAggregator(registry, recorder, new HealthDetailResolver(objectMapper), serverClock);
    }
}
