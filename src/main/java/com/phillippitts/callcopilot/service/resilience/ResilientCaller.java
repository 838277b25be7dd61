package com.phillippitts.callcopilot.service.resilience;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Guards every outbound call as {@code retry(breaker(call))}: each attempt passes through
 * the destination's breaker, and a rejection by an open breaker is not retried.
 */
public class ResilientCaller {

    private final RetryExecutor retryExecutor;
    private final CircuitBreakerRegistry breakers;

    public ResilientCaller(RetryExecutor retryExecutor, CircuitBreakerRegistry breakers) {
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor must not be null");
        this.breakers = Objects.requireNonNull(breakers, "breakers must not be null");
    }

    public <T> CompletableFuture<T> call(Destination destination, String operationName,
                                         Supplier<CompletableFuture<T>> operation) {
        CircuitBreaker breaker = breakers.get(destination);
        return retryExecutor.execute(destination.tag() + ":" + operationName, () -> breaker.call(operation));
    }
}
