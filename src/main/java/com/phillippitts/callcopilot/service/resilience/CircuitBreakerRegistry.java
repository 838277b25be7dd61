package com.phillippitts.callcopilot.service.resilience;

import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One {@link CircuitBreaker} per {@link Destination}, created eagerly and shared by all
 * sessions for the life of the process.
 *
 * <p>Constructed as a regular bean so tests can build isolated instances.
 */
public class CircuitBreakerRegistry {

    private final Map<Destination, CircuitBreaker> breakers;

    public CircuitBreakerRegistry(int failureThreshold, Duration recoveryTimeout, Clock clock,
                                  ApplicationEventPublisher publisher) {
        Map<Destination, CircuitBreaker> map = new EnumMap<>(Destination.class);
        for (Destination destination : Destination.values()) {
            map.put(destination, new CircuitBreaker(destination, failureThreshold, recoveryTimeout, clock, publisher));
        }
        this.breakers = Collections.unmodifiableMap(map);
    }

    public CircuitBreaker get(Destination destination) {
        return breakers.get(destination);
    }

    public Map<Destination, CircuitBreaker> all() {
        return breakers;
    }
}
