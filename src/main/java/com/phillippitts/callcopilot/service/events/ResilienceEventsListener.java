package com.phillippitts.callcopilot.service.events;

import com.phillippitts.callcopilot.service.metrics.CopilotMetrics;
import com.phillippitts.callcopilot.service.resilience.CircuitBreaker;
import com.phillippitts.callcopilot.service.resilience.CircuitStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs and counts circuit breaker transitions. Opening is logged at WARN, throttled per
 * destination so a flapping breaker does not flood the log.
 */
@Component
class ResilienceEventsListener {

    private static final Logger LOG = LogManager.getLogger(ResilienceEventsListener.class);
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final CopilotMetrics metrics;

    ResilienceEventsListener(CopilotMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onCircuitStateChanged(CircuitStateChangedEvent e) {
        String destination = e.destination().tag();
        metrics.breakerTransition(destination, e.to().name());

        if (e.to() == CircuitBreaker.State.OPEN) {
            if (shouldLog("open-" + destination, e.at())) {
                LOG.warn("Circuit breaker for {} opened after {} consecutive failures; rejecting calls",
                        destination, e.consecutiveFailures());
            }
        } else if (e.to() == CircuitBreaker.State.CLOSED) {
            LOG.info("Circuit breaker for {} closed; {} reachable again", destination, destination);
        } else {
            LOG.info("Circuit breaker for {} half-open; allowing one trial call", destination);
        }
    }

    // Package-private for tests
    boolean shouldLog(String key, Instant now) {
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
