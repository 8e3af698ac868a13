package com.harbor.server.infrastructure.web;

import com.harbor.observability.CorrelationContext;
import com.harbor.observability.CorrelationContextHolder;
import com.harbor.observability.CorrelationIdGenerator;
import com.harbor.server.config.HarborServerProperties;
import com.harbor.server.metrics.Recorder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Outermost servlet filter: correlation IDs, panic recovery, request logging and request metrics.
 *
 * <p>For every request it:
 *
 * <ol>
 *   <li>adopts the inbound {@code Correlation-ID} header (when enabled) or generates one, echoes
 *       it on the response before the handler runs, and binds it to {@link
 *       CorrelationContextHolder} so every log line carries it
 *   <li>runs the rest of the chain with a {@link TelemetryResponseWrapper}
 *   <li>turns any exception thrown by the chain into a 500 (when the response is not yet
 *       committed) and one ERROR log entry
 *   <li>logs a {@code request complete} entry and reports duration and size to the {@link
 *       Recorder}, labelled with the matched route template
 * </ol>
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so it sees every other filter's failures.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TelemetryFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TelemetryFilter.class);

    public static final String CORRELATION_ID_HEADER = "Correlation-ID";

    private final Recorder recorder;
    private final CorrelationIdGenerator correlationIdGenerator;
    private final boolean readCorrelationHeader;

    public TelemetryFilter(Recorder recorder, CorrelationIdGenerator correlationIdGenerator,
                           HarborServerProperties properties) {
        this.recorder = recorder;
        this.correlationIdGenerator = correlationIdGenerator;
        this.readCorrelationHeader = properties.readCorrelationHeader();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        long startNanos = System.nanoTime();
        TelemetryResponseWrapper wrapper = new TelemetryResponseWrapper(response);

        String correlationId = resolveCorrelationId(request);
        wrapper.setHeader(CORRELATION_ID_HEADER, correlationId);
        CorrelationContextHolder.set(new CorrelationContext(correlationId));

        try {
            filterChain.doFilter(request, wrapper);
        } catch (Throwable failure) {
            recover(wrapper, failure);
        } finally {
            try {
                complete(request, wrapper, Duration.ofNanos(System.nanoTime() - startNanos));
            } finally {
                CorrelationContextHolder.clear();
            }
        }
    }

    private String resolveCorrelationId(HttpServletRequest request) {
        if (readCorrelationHeader) {
            String inbound = request.getHeader(CORRELATION_ID_HEADER);
            if (inbound != null && !inbound.isBlank()) {
                return inbound;
            }
        }
        return correlationIdGenerator.newCorrelationId();
    }

    private void recover(TelemetryResponseWrapper response, Throwable failure) {
        HandlerPanicException panic = new HandlerPanicException(NestedExceptionUtils.getMostSpecificCause(failure));
        if (!response.isCommitted()) {
            try {
                response.resetBuffer();
                response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            } catch (IllegalStateException e) {
                // Committed by the container in between; the status already sent stands.
                panic.addSuppressed(e);
            }
        }
        log.atError()
                .setCause(panic)
                .addKeyValue("committed", response.isCommitted())
                .log(panic.getMessage());
    }

    private void complete(HttpServletRequest request, TelemetryResponseWrapper response, Duration duration) {
        response.flushWriter();

        String method = request.getMethod();
        String path = routeTemplate(request);
        int statusCode = response.getStatusCode();
        long bytes = response.getSize();

        log.atInfo()
                .addKeyValue("method", method)
                .addKeyValue("url", fullUrl(request))
                .addKeyValue("userAgent", request.getHeader(HttpHeaders.USER_AGENT))
                .addKeyValue("statusCode", statusCode)
                .addKeyValue("durationMs", duration.toMillis())
                .addKeyValue("responseBytes", bytes)
                .log("request complete");

        recorder.observeRequestDuration(method, path, statusCode, duration);
        recorder.observeResponseSize(method, path, statusCode, bytes);
    }

    private static String routeTemplate(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : request.getRequestURI();
    }

    private static String fullUrl(HttpServletRequest request) {
        String query = request.getQueryString();
        return query != null ? request.getRequestURI() + "?" + query : request.getRequestURI();
    }
}
