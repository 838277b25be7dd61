package com.phillippitts.callcopilot.service.events;

import com.phillippitts.callcopilot.service.metrics.CopilotMetrics;
import com.phillippitts.callcopilot.service.resilience.CircuitBreaker;
import com.phillippitts.callcopilot.service.resilience.CircuitStateChangedEvent;
import com.phillippitts.callcopilot.service.resilience.Destination;
import com.phillippitts.callcopilot.testutil.InMemoryAppender;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ResilienceEventsListenerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private SimpleMeterRegistry meters;
    private ResilienceEventsListener listener;
    private InMemoryAppender appender;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        listener = new ResilienceEventsListener(new CopilotMetrics(meters));
        appender = InMemoryAppender.attachTo(ResilienceEventsListener.class);
    }

    @AfterEach
    void tearDown() {
        appender.detach();
    }

    private static CircuitStateChangedEvent opened(Instant at) {
        return new CircuitStateChangedEvent(Destination.KB, CircuitBreaker.State.CLOSED,
                CircuitBreaker.State.OPEN, 5, at);
    }

    @Test
    void throttlesRepeatLogs() {
        assertThat(listener.shouldLog("open-kb", T0)).isTrue();
        assertThat(listener.shouldLog("open-kb", T0.plusSeconds(10))).isFalse();
        assertThat(listener.shouldLog("open-llm", T0.plusSeconds(10))).isTrue();
        assertThat(listener.shouldLog("open-kb", T0.plus(Duration.ofMinutes(2)))).isTrue();
    }

    @Test
    void countsEveryTransitionButWarnsOncePerWindow() {
        listener.onCircuitStateChanged(opened(T0));
        listener.onCircuitStateChanged(opened(T0.plusSeconds(5)));

        assertThat(meters.counter("callcopilot.breaker.transitions", "destination", "kb", "state", "OPEN").count())
                .isEqualTo(2.0);
        assertThat(appender.getEvents())
                .filteredOn(e -> e.getLevel() == Level.WARN)
                .hasSize(1);
    }

    @Test
    void logsRecoveryAtInfo() {
        listener.onCircuitStateChanged(new CircuitStateChangedEvent(Destination.FRONTEND,
                CircuitBreaker.State.HALF_OPEN, CircuitBreaker.State.CLOSED, 0, T0));

        assertThat(appender.contains(Level.INFO, "closed")).isTrue();
        assertThat(meters.counter("callcopilot.breaker.transitions", "destination", "frontend", "state", "CLOSED")
                .count()).isEqualTo(1.0);
    }
}
