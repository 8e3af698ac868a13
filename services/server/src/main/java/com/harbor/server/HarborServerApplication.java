package com.harbor.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Standalone Harbor server.
 *
 * <p>Serves /ping, /version, /metrics and /health out of the box. Dependencies to check are
 * declared as {@link com.harbor.server.config.HealthDependency} beans; extra routes as {@code
 * RouterFunction} beans or controllers. To run the server inside another program, use {@link
 * HarborServer} instead.
 */
@SpringBootApplication
public class HarborServerApplication {

    private static final Logger log = LoggerFactory.getLogger(HarborServerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HarborServerApplication.class, args);
        log.info("Harbor server started successfully");
    }
}
