package com.harbor.server.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.harbor.observability.AggregateResult;
import com.harbor.observability.DependencyNotFoundException;
import com.harbor.observability.HealthAggregator;
import com.harbor.observability.HealthCheckContext;
import com.harbor.observability.ServiceHealth;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Aggregate and per-dependency health endpoints.
 *
 * <p>Both answer 200 when healthy and 500 when not, always with a JSON content type. The body is
 * only written when the {@code verbose} query parameter is present (with any value).
 */
@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    static final String VERBOSE_PARAM = "verbose";
    static final MediaType TEXT_PLAIN_UTF8 = MediaType.parseMediaType("text/plain; charset=utf-8");

    private final HealthAggregator aggregator;

    public HealthController(HealthAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @GetMapping("/health")
    public ResponseEntity<AggregateResult> health(HttpServletRequest request) {
        AggregateResult result = aggregator.checkAll(HealthCheckContext.current());
        log.atInfo().addKeyValue("health", result).log("health check");

        return ResponseEntity.status(result.isHealthy() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(isVerbose(request) ? result : null);
    }

    @GetMapping("/health/{name}")
    public ResponseEntity<JsonNode> dependencyHealth(@PathVariable String name, HttpServletRequest request) {
        ServiceHealth health = aggregator.checkOne(HealthCheckContext.current(), name);
        log.atInfo().addKeyValue("health", health).log("health check");

        return ResponseEntity.status(health.isHealthy() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(isVerbose(request) ? health.toBody() : null);
    }

    @ExceptionHandler(DependencyNotFoundException.class)
    public ResponseEntity<String> dependencyNotFound(DependencyNotFoundException e) {
        log.debug("Health requested for unknown dependency '{}'", e.name());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .contentType(TEXT_PLAIN_UTF8)
                .body("404 page not found");
    }

    private static boolean isVerbose(HttpServletRequest request) {
        return request.getParameter(VERBOSE_PARAM) != null;
    }
}
