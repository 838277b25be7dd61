package com.phillippitts.callcopilot.service.resilience;

import com.phillippitts.callcopilot.exception.UpstreamException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retries an asynchronous operation with exponential backoff.
 *
 * <p>Only failures accepted by the retryable predicate are retried; anything else
 * completes the returned future immediately without consuming the retry budget. After
 * the budget is spent, the last failure is surfaced unchanged.
 *
 * <p>Backoff delays are handed to a {@link DelayScheduler}, so no thread blocks between
 * attempts. Each invocation gets a correlation id that only appears in logs.
 */
public class RetryExecutor {

    private static final Logger LOG = LogManager.getLogger(RetryExecutor.class);

    private final RetryPolicy policy;
    private final DelayScheduler scheduler;
    private final Predicate<Throwable> retryable;

    public RetryExecutor(RetryPolicy policy, DelayScheduler scheduler) {
        this(policy, scheduler, RetryExecutor::isRetryable);
    }

    public RetryExecutor(RetryPolicy policy, DelayScheduler scheduler, Predicate<Throwable> retryable) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.retryable = Objects.requireNonNull(retryable, "retryable must not be null");
    }

    /**
     * Runs {@code operation}, retrying per policy.
     *
     * @param operationName short label for logs
     * @param operation supplier invoked once per attempt
     * @param <T> result type
     * @return future completing with the first successful result or the last failure
     */
    public <T> CompletableFuture<T> execute(String operationName, Supplier<CompletableFuture<T>> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        String correlationId = newCorrelationId();
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(operationName, correlationId, operation, 0, result);
        return result;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private <T> void attempt(String operationName, String correlationId,
                             Supplier<CompletableFuture<T>> operation, int attempt,
                             CompletableFuture<T> result) {
        CompletableFuture<T> call;
        try {
            call = operation.get();
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenComplete((value, error) -> {
            if (error == null) {
                if (attempt > 0) {
                    LOG.info("{} succeeded after {} retries (corr={})", operationName, attempt, correlationId);
                }
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (!retryable.test(cause)) {
                LOG.debug("{} failed with non-retryable error (corr={}): {}",
                        operationName, correlationId, cause.toString());
                result.completeExceptionally(cause);
                return;
            }
            if (attempt >= policy.maxRetries()) {
                LOG.error("{} failed after {} retries (corr={}): {}",
                        operationName, attempt, correlationId, cause.toString());
                result.completeExceptionally(cause);
                return;
            }
            Duration delay = policy.delayFor(attempt);
            LOG.warn("{} attempt {}/{} failed (corr={}): {}. Retrying in {} ms",
                    operationName, attempt + 1, policy.maxRetries() + 1, correlationId,
                    cause.toString(), delay.toMillis());
            try {
                scheduler.schedule(() -> attempt(operationName, correlationId, operation, attempt + 1, result),
                        delay);
            } catch (RuntimeException scheduleFailure) {
                LOG.error("Could not schedule retry for {} (corr={})", operationName, correlationId,
                        scheduleFailure);
                result.completeExceptionally(cause);
            }
        });
    }

    /**
     * Default retryable classification: upstream failures flagged retryable, I/O errors
     * and timeouts.
     */
    public static boolean isRetryable(Throwable error) {
        if (error instanceof UpstreamException upstream) {
            return upstream.isRetryable();
        }
        return error instanceof IOException || error instanceof TimeoutException;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String newCorrelationId() {
        return "corr-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
