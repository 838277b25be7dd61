package com.phillippitts.callcopilot.service.health;

import com.phillippitts.callcopilot.service.resilience.CircuitBreaker;
import com.phillippitts.callcopilot.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.callcopilot.service.resilience.Destination;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reports downstream availability from the circuit breakers.
 *
 * <ul>
 *   <li>UP: every breaker CLOSED</li>
 *   <li>DEGRADED: at least one breaker OPEN or HALF_OPEN</li>
 * </ul>
 *
 * <p>Never DOWN: calls keep streaming and transcribing while downstream forwards fail.
 * Exposed via /actuator/health.
 */
@Component
public class CircuitBreakerHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final CircuitBreakerRegistry breakers;

    public CircuitBreakerHealthIndicator(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        boolean allClosed = true;
        for (Map.Entry<Destination, CircuitBreaker> entry : breakers.all().entrySet()) {
            CircuitBreaker breaker = entry.getValue();
            if (breaker.getState() != CircuitBreaker.State.CLOSED) {
                allClosed = false;
            }
            builder.withDetail(entry.getKey().tag(), describe(breaker));
        }

        if (allClosed) {
            builder.up();
        } else {
            builder.status(DEGRADED);
        }
        return builder.build();
    }

    private static String describe(CircuitBreaker breaker) {
        if (breaker.getState() == CircuitBreaker.State.CLOSED) {
            return "closed";
        }
        return breaker.getState().name().toLowerCase() + " (failures=" + breaker.getConsecutiveFailures() + ")";
    }
}
