package com.phillippitts.callcopilot.service.resilience;

import java.time.Instant;
import java.util.Objects;

/**
 * Published whenever a destination's circuit breaker changes state.
 *
 * @param destination destination whose breaker moved
 * @param from previous state
 * @param to new state
 * @param consecutiveFailures failure count at the moment of the transition
 * @param at transition time
 */
public record CircuitStateChangedEvent(Destination destination,
                                       CircuitBreaker.State from,
                                       CircuitBreaker.State to,
                                       int consecutiveFailures,
                                       Instant at) {

    public CircuitStateChangedEvent {
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }
}
