package com.harbor.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ServerClock")
class ServerClockTest {

    private static final Instant STARTED = Instant.parse("2024-05-01T10:00:00Z");

    private final Clock clock = mock(Clock.class);

    @Test
    @DisplayName("reports zero uptime before start")
    void zeroBeforeStart() {
        var serverClock = new ServerClock("1.0.0", clock);

        assertThat(serverClock.isRunning()).isFalse();
        assertThat(serverClock.uptime()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("reports time elapsed since start")
    void elapsedSinceStart() {
        when(clock.instant()).thenReturn(STARTED, STARTED.plusSeconds(90));
        var serverClock = new ServerClock("1.0.0", clock);

        serverClock.start();

        assertThat(serverClock.isRunning()).isTrue();
        assertThat(serverClock.uptime()).isEqualTo(Duration.ofSeconds(90));
    }

    @Test
    @DisplayName("reports zero uptime after stop")
    void zeroAfterStop() {
        when(clock.instant()).thenReturn(STARTED);
        var serverClock = new ServerClock("1.0.0", clock);

        serverClock.start();
        serverClock.stop();

        assertThat(serverClock.isRunning()).isFalse();
        assertThat(serverClock.uptime()).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("exposes the configured version")
    void exposesVersion() {
        assertThat(new ServerClock("2.1.0", clock).version()).isEqualTo("2.1.0");
        assertThat(new ServerClock(null, clock).version()).isNull();
    }

    @Test
    @DisplayName("rejects a null clock")
    void rejectsNullClock() {
        assertThatThrownBy(() -> new ServerClock("1.0.0", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("clock");
    }
}
