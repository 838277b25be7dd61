package com.phillippitts.callcopilot.service.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff parameters. Immutable and shared across calls.
 *
 * @param maxRetries additional attempts after the first one
 * @param initialDelay delay before the first retry
 * @param maxDelay upper bound for any single delay
 * @param backoffMultiplier growth factor applied per attempt
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, double backoffMultiplier) {

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0: " + backoffMultiplier);
        }
    }

    /**
     * Delay before retry number {@code attempt + 1}: {@code initialDelay * multiplier^attempt},
     * capped at {@code maxDelay}.
     *
     * @param attempt zero-based index of the attempt that just failed
     * @return delay to wait before the next attempt
     */
    public Duration delayFor(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(backoffMultiplier, attempt);
        long capped = (long) Math.min(millis, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
