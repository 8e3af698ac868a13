package com.harbor.server;

import com.harbor.observability.CorrelationIdGenerator;
import com.harbor.observability.HealthChecker;
import com.harbor.server.api.HealthController;
import com.harbor.server.api.SystemController;
import com.harbor.server.config.HarborServerConfig;
import com.harbor.server.config.HealthDependency;
import com.harbor.server.config.ServerClock;
import com.harbor.server.infrastructure.web.TelemetryFilter;
import com.harbor.server.metrics.Recorder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Import;
import org.springframework.core.env.MapPropertySource;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * Embeddable Harbor server.
 *
 * <pre>{@code
 * HarborServer server = HarborServer.builder()
 *         .version("1.4.2")
 *         .port(8080)
 *         .healthDependency("postgres", context -> dataSource.ping())
 *         .route(RouterFunctions.route().GET("/orders/{id}", orders::get).build())
 *         .build();
 * server.start();
 * }</pre>
 *
 * <p>Every route, built-in or supplied, passes through the telemetry filter. A server can be
 * started again after {@link #stop()}.
 */
public final class HarborServer {

    private static final Logger log = LoggerFactory.getLogger(HarborServer.class);

    public static final int DEFAULT_PORT = 5000;
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(5);

    private final String version;
    private final int port;
    private final Duration readTimeout;
    private final boolean readCorrelationHeader;
    private final CorrelationIdGenerator correlationIdGenerator;
    private final Recorder recorder;
    private final Map<String, HealthChecker> healthDependencies;
    private final List<RouterFunction<ServerResponse>> routes;
    private final Map<String, Object> properties;

    private final Object lock = new Object();
    private ConfigurableApplicationContext context;
    private ServerClock clock;

    private HarborServer(Builder builder) {
        this.version = builder.version;
        this.port = builder.port;
        this.readTimeout = builder.readTimeout;
        this.readCorrelationHeader = builder.readCorrelationHeader;
        this.correlationIdGenerator = builder.correlationIdGenerator;
        this.recorder = builder.recorder;
        this.healthDependencies = new LinkedHashMap<>(builder.healthDependencies);
        this.routes = List.copyOf(builder.routes);
        this.properties = new LinkedHashMap<>(builder.properties);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Boots the embedded web server and returns once it accepts connections.
     *
     * @throws IllegalStateException    if the server is already running
     * @throws ServerLifecycleException if the server fails to start, for example when the port is taken
     */
    public void start() {
        synchronized (lock) {
            if (context != null) {
                throw new IllegalStateException("server already started");
            }
            try {
                context = new SpringApplicationBuilder(EmbeddedServerConfiguration.class)
                        .web(WebApplicationType.SERVLET)
                        .bannerMode(Banner.Mode.OFF)
                        .logStartupInfo(false)
                        .initializers(this::configure)
                        .run();
            } catch (RuntimeException e) {
                throw new ServerLifecycleException("failed to start server on port " + port, e);
            }
            clock = context.getBean(ServerClock.class);
            log.info("Harbor server listening on port {}", port());
        }
    }

    /**
     * Shuts the server down gracefully, waiting up to one minute for in-flight requests. Does
     * nothing when the server is not running.
     *
     * @throws ServerLifecycleException if shutdown fails
     */
    public void stop() {
        synchronized (lock) {
            if (context == null) {
                return;
            }
            try {
                context.close();
                log.info("Harbor server stopped");
            } catch (RuntimeException e) {
                throw new ServerLifecycleException("failed to stop server", e);
            } finally {
                context = null;
            }
        }
    }

    /**
     * Returns the port the server is listening on, or -1 when it is not running.
     */
    public int port() {
        synchronized (lock) {
            if (context instanceof WebServerApplicationContext web && web.getWebServer() != null) {
                return web.getWebServer().getPort();
            }
            return -1;
        }
    }

    /**
     * Returns how long the server has been running; zero when it is not running.
     */
    public Duration uptime() {
        synchronized (lock) {
            return clock != null ? clock.uptime() : Duration.ZERO;
        }
    }

    public String version() {
        return version;
    }

    private void configure(ConfigurableApplicationContext applicationContext) {
        Map<String, Object> values = new LinkedHashMap<>(properties);
        values.put("server.port", port);
        values.put("server.tomcat.connection-timeout", readTimeout.toMillis() + "ms");
        values.put("harbor.server.read-correlation-header", readCorrelationHeader);
        if (version != null) {
            values.put("harbor.server.version", version);
        }
        applicationContext.getEnvironment().getPropertySources()
                .addFirst(new MapPropertySource("harborServer", values));

        ConfigurableListableBeanFactory beanFactory = applicationContext.getBeanFactory();
        if (recorder != null) {
            beanFactory.registerSingleton("harborRecorder", recorder);
        }
        if (correlationIdGenerator != null) {
            beanFactory.registerSingleton("harborCorrelationIdGenerator", correlationIdGenerator);
        }
        int index = 0;
        for (Map.Entry<String, HealthChecker> entry : healthDependencies.entrySet()) {
            beanFactory.registerSingleton("harborHealthDependency" + index++,
                    new HealthDependency(entry.getKey(), entry.getValue()));
        }
        index = 0;
        for (RouterFunction<ServerResponse> route : routes) {
            beanFactory.registerSingleton("harborRoute" + index++, route);
        }
    }

    /**
     * Application root for the embedded server. Not a component, so the standalone
     * application's scan never picks it up.
     */
    @EnableAutoConfiguration
    @Import({HarborServerConfig.class, TelemetryFilter.class, HealthController.class, SystemController.class})
    static class EmbeddedServerConfiguration {
    }

    /**
     * Collects the options of a {@link HarborServer}.
     */
    public static final class Builder {

        private String version;
        private int port = DEFAULT_PORT;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;
        private boolean readCorrelationHeader;
        private CorrelationIdGenerator correlationIdGenerator;
        private Recorder recorder;
        private final Map<String, HealthChecker> healthDependencies = new LinkedHashMap<>();
        private final List<RouterFunction<ServerResponse>> routes = new ArrayList<>();
        private final Map<String, Object> properties = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /**
         * Port to listen on; 0 picks a free one.
         */
        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 0 and 65535");
            }
            this.port = port;
            return this;
        }

        /**
         * How long a connection may sit idle while a request is being read.
         */
        public Builder readTimeout(Duration readTimeout) {
            if (readTimeout == null || readTimeout.isNegative()) {
                throw new IllegalArgumentException("readTimeout must not be null or negative");
            }
            this.readTimeout = readTimeout;
            return this;
        }

        /**
         * Adopt the inbound {@code Correlation-ID} header when a request carries one.
         */
        public Builder readCorrelationHeader() {
            this.readCorrelationHeader = true;
            return this;
        }

        public Builder correlationIdGenerator(CorrelationIdGenerator generator) {
            if (generator == null) {
                throw new IllegalArgumentException("generator must not be null");
            }
            this.correlationIdGenerator = generator;
            return this;
        }

        public Builder recorder(Recorder recorder) {
            if (recorder == null) {
                throw new IllegalArgumentException("recorder must not be null");
            }
            this.recorder = recorder;
            return this;
        }

        /**
         * Adds a dependency to /health. Adding the same name again replaces the earlier checker.
         */
        public Builder healthDependency(String name, HealthChecker checker) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be null or blank");
            }
            if (checker == null) {
                throw new IllegalArgumentException("checker must not be null");
            }
            healthDependencies.put(name, checker);
            return this;
        }

        public Builder route(RouterFunction<ServerResponse> route) {
            if (route == null) {
                throw new IllegalArgumentException("route must not be null");
            }
            routes.add(route);
            return this;
        }

        /**
         * Sets any Spring Boot property, taking precedence over application.yml.
         */
        public Builder property(String key, Object value) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("key must not be null or blank");
            }
            properties.put(key, value);
            return this;
        }

        public HarborServer build() {
            return new HarborServer(this);
        }
    }
}
