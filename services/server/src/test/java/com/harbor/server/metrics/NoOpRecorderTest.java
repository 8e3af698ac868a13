package com.harbor.server.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("NoOpRecorder")
class NoOpRecorderTest {

    @Test
    @DisplayName("accepts observations and serves an empty 200")
    void servesEmptyResponse() throws Exception {
        var recorder = new NoOpRecorder();
        recorder.observeRequestDuration("GET", "/ping", 200, Duration.ofMillis(1));
        recorder.observeResponseSize("GET", "/ping", 200, 4);
        recorder.observeHealth("db", true);
        var response = new MockHttpServletResponse();

        recorder.handler().handleRequest(new MockHttpServletRequest("GET", "/metrics"), response);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(response.getContentAsString()).isEmpty();
    }
}
