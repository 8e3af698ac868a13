package com.harbor.server.api;

import com.harbor.observability.ServerInfo;
import com.harbor.server.metrics.Recorder;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness, version and metrics endpoints.
 */
@RestController
public class SystemController {

    static final String UNVERSIONED = "unversioned";

    private final ServerInfo serverInfo;
    private final Recorder recorder;

    public SystemController(ServerInfo serverInfo, Recorder recorder) {
        this.serverInfo = serverInfo;
        this.recorder = recorder;
    }

    @GetMapping(value = "/ping", produces = MediaType.TEXT_PLAIN_VALUE)
    public String ping() {
        return "pong";
    }

    @GetMapping(value = "/version", produces = MediaType.TEXT_PLAIN_VALUE)
    public String version() {
        String version = serverInfo.version();
        return version != null ? version : UNVERSIONED;
    }

    @GetMapping("/metrics")
    public void metrics(HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        recorder.handler().handleRequest(request, response);
    }
}
