package com.phillippitts.callcopilot.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for call sessions and downstream forwarding.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Carrier frames accepted and rejected, by reason</li>
 *   <li>Sessions started, failed and closed</li>
 *   <li>Forward outcomes and latency per kind (transcript, intent, kb, disposition)</li>
 *   <li>Circuit breaker transitions per destination</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class CopilotMetrics {

    private static final String METRIC_PREFIX = "callcopilot";

    private final MeterRegistry registry;

    public CopilotMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void frameAccepted(String event) {
        Counter.builder(METRIC_PREFIX + ".frames.accepted")
                .description("Carrier frames processed")
                .tag("event", event)
                .register(registry)
                .increment();
    }

    /**
     * @param reason parse, payload, inactive or protocol
     */
    public void frameRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".frames.rejected")
                .description("Carrier frames dropped")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void sessionStarted() {
        Counter.builder(METRIC_PREFIX + ".sessions.started")
                .description("Sessions that reached ACTIVE")
                .register(registry)
                .increment();
    }

    public void sessionFailed() {
        Counter.builder(METRIC_PREFIX + ".sessions.failed")
                .description("Sessions whose pipeline could not be created")
                .register(registry)
                .increment();
    }

    public void sessionClosed(String trigger) {
        Counter.builder(METRIC_PREFIX + ".sessions.closed")
                .description("Sessions closed")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of one forward (after retries).
     *
     * @param kind transcript, intent, kb or disposition
     * @param success whether it was delivered
     * @param durationNanos time including retries
     */
    public void recordForward(String kind, boolean success, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".forward")
                .description("Forwards to the case-management backend")
                .tag("kind", kind)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".forward.latency")
                .description("Time to forward, including retries")
                .tag("kind", kind)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void intentDetected(String intent) {
        Counter.builder(METRIC_PREFIX + ".intent")
                .description("Detected intents")
                .tag("intent", intent)
                .register(registry)
                .increment();
    }

    public void dispositionFallback() {
        Counter.builder(METRIC_PREFIX + ".disposition.fallback")
                .description("Calls closed with the fallback disposition")
                .register(registry)
                .increment();
    }

    public void breakerTransition(String destination, String state) {
        Counter.builder(METRIC_PREFIX + ".breaker.transitions")
                .description("Circuit breaker state changes")
                .tag("destination", destination)
                .tag("state", state)
                .register(registry)
                .increment();
    }
}
