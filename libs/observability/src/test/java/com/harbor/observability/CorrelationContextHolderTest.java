package com.harbor.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: validates ThreadLocal storage,
 * MDC bridge, context clearing, and scoped execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        // Ensure no context leaks between tests
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).isPresent().contains(ctx);
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject blank correlation ID")
        void shouldRejectBlankCorrelationId() {
            assertThatThrownBy(() -> new CorrelationContext(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1"));

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
        }

        @Test
        @DisplayName("should clear MDC when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
        }
    }

    @Nested
    @DisplayName("scoped execution")
    class ScopedExecution {

        @Test
        @DisplayName("should set context for the duration of the runnable and restore afterwards")
        void shouldSetContextAndRestore() {
            CorrelationContextHolder.set(new CorrelationContext("outer-corr"));

            AtomicReference<String> captured = new AtomicReference<>();
            CorrelationContextHolder.runWithContext(new CorrelationContext("inner-corr"), () ->
                    captured.set(MDC.get(CorrelationContext.MDC_CORRELATION_ID)));

            assertThat(captured.get()).isEqualTo("inner-corr");
            assertThat(CorrelationContextHolder.get().map(CorrelationContext::correlationId))
                    .contains("outer-corr");
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("outer-corr");
        }

        @Test
        @DisplayName("should return the supplier's value and clear when no previous context existed")
        void shouldSupplyAndClear() {
            String result = CorrelationContextHolder.supplyWithContext(new CorrelationContext("temp-corr"),
                    () -> CorrelationContextHolder.get().orElseThrow().correlationId());

            assertThat(result).isEqualTo("temp-corr");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should restore context even if runnable throws")
        void shouldRestoreOnException() {
            CorrelationContextHolder.set(new CorrelationContext("outer-corr"));

            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(new CorrelationContext("inner-corr"),
                    () -> {
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.get().map(CorrelationContext::correlationId))
                    .contains("outer-corr");
        }
    }

    @Nested
    @DisplayName("Thread isolation")
    class ThreadIsolation {

        @Test
        @DisplayName("should not leak context across threads")
        void shouldNotLeakAcrossThreads() throws InterruptedException {
            CorrelationContextHolder.set(new CorrelationContext("main-corr"));

            AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
            Thread other = new Thread(() ->
                    otherThreadHasContext.set(CorrelationContextHolder.get().isPresent()));
            other.start();
            other.join();

            assertThat(otherThreadHasContext.get()).isFalse();
        }
    }
}
