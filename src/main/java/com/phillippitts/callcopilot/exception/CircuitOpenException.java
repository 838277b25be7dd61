package com.phillippitts.callcopilot.exception;

/**
 * Thrown when a circuit breaker rejects a call without attempting it.
 * Never retryable.
 */
public class CircuitOpenException extends UpstreamException {

    public CircuitOpenException(String destination) {
        super("Circuit breaker is OPEN - service unavailable (destination: " + destination + ")",
                destination, NO_STATUS, false);
    }
}
