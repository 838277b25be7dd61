/**
 * Retry with exponential backoff and per-destination circuit breakers for outbound calls.
 *
 * <p>Calls are composed as {@code retry(breaker(call))} by
 * {@link com.phillippitts.callcopilot.service.resilience.ResilientCaller}:
 * <ul>
 *   <li>{@link com.phillippitts.callcopilot.service.resilience.RetryExecutor} - re-invokes a
 *       failed call after {@code initialDelay * multiplier^attempt}, capped at
 *       {@code maxDelay}. Delays are scheduled, never slept.</li>
 *   <li>{@link com.phillippitts.callcopilot.service.resilience.CircuitBreaker} - CLOSED, OPEN
 *       and HALF_OPEN per {@link com.phillippitts.callcopilot.service.resilience.Destination}.
 *       An open breaker fails fast with
 *       {@link com.phillippitts.callcopilot.exception.CircuitOpenException}, which is never
 *       retried.</li>
 * </ul>
 *
 * <p>Breaker transitions are published as
 * {@link com.phillippitts.callcopilot.service.resilience.CircuitStateChangedEvent}s.
 *
 * @since 0.1
 */
package com.phillippitts.callcopilot.service.resilience;
