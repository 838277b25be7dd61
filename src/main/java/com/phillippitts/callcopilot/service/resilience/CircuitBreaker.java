package com.phillippitts.callcopilot.service.resilience;

import com.phillippitts.callcopilot.exception.CircuitOpenException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Thread-safe circuit breaker for one outbound destination.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * CLOSED    → OPEN      (failureThreshold consecutive failures)
 * OPEN      → HALF_OPEN (first call after recoveryTimeout since the last failure)
 * HALF_OPEN → CLOSED    (trial call succeeds; failures reset to 0)
 * HALF_OPEN → OPEN      (trial call fails; lastFailureTime refreshed)
 * </pre>
 *
 * <p>While OPEN, and while a HALF_OPEN trial is in flight, calls are rejected with
 * {@link CircuitOpenException} and the underlying operation is never invoked.
 *
 * <p>Outcomes of calls admitted while CLOSED that settle after the breaker has left CLOSED
 * are ignored. Only the trial call decides how HALF_OPEN ends.
 *
 * <p><b>Thread Safety:</b> state is guarded by a {@link ReentrantLock}. Transition events
 * are published after the lock is released.
 */
public final class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    /**
     * Breaker states.
     */
    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final Destination destination;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    private final Lock lock = new ReentrantLock();
    private State state = State.CLOSED;
    private int consecutiveFailures;
    private Instant lastFailureTime;
    private boolean trialInFlight;

    public CircuitBreaker(Destination destination, int failureThreshold, Duration recoveryTimeout,
                          Clock clock, ApplicationEventPublisher publisher) {
        this.destination = Objects.requireNonNull(destination, "destination must not be null");
        this.recoveryTimeout = Objects.requireNonNull(recoveryTimeout, "recoveryTimeout must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive: " + failureThreshold);
        }
        this.failureThreshold = failureThreshold;
    }

    /**
     * Runs {@code operation} if the breaker admits it and records the outcome.
     *
     * @param operation asynchronous call to the destination
     * @param <T> result type
     * @return the operation's future, or a future failed with {@link CircuitOpenException}
     */
    public <T> CompletableFuture<T> call(Supplier<CompletableFuture<T>> operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        Admission admission = admit();
        if (admission == Admission.REJECTED) {
            return CompletableFuture.failedFuture(new CircuitOpenException(destination.tag()));
        }
        boolean trial = admission == Admission.TRIAL;
        CompletableFuture<T> future;
        try {
            future = operation.get();
        } catch (RuntimeException e) {
            onFailure(trial);
            return CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((value, error) -> {
            if (error == null) {
                onSuccess(trial);
            } else {
                onFailure(trial);
            }
        });
    }

    private enum Admission {
        REJECTED,
        NORMAL,
        TRIAL
    }

    boolean tryAcquirePermission() {
        return admit() != Admission.REJECTED;
    }

    /**
     * Decides whether one call may proceed. Moves OPEN to HALF_OPEN once the recovery
     * timeout has elapsed; the caller that triggers the move becomes the trial call.
     */
    private Admission admit() {
        CircuitStateChangedEvent transition = null;
        Admission admission;
        lock.lock();
        try {
            switch (state) {
                case CLOSED -> admission = Admission.NORMAL;
                case OPEN -> {
                    Instant now = clock.instant();
                    if (lastFailureTime != null
                            && !now.isBefore(lastFailureTime.plus(recoveryTimeout))) {
                        transition = moveTo(State.HALF_OPEN, now);
                        trialInFlight = true;
                        admission = Admission.TRIAL;
                    } else {
                        admission = Admission.REJECTED;
                    }
                }
                case HALF_OPEN -> {
                    if (trialInFlight) {
                        admission = Admission.REJECTED;
                    } else {
                        trialInFlight = true;
                        admission = Admission.TRIAL;
                    }
                }
                default -> throw new IllegalStateException("Unknown state: " + state);
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
        if (admission == Admission.REJECTED) {
            LOG.debug("Circuit breaker for {} rejected call (state={})", destination.tag(), getState());
        }
        return admission;
    }

    private void onSuccess(boolean trial) {
        CircuitStateChangedEvent transition = null;
        lock.lock();
        try {
            if (state == State.CLOSED) {
                consecutiveFailures = 0;
            } else if (state == State.HALF_OPEN && trial) {
                consecutiveFailures = 0;
                trialInFlight = false;
                transition = moveTo(State.CLOSED, clock.instant());
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    private void onFailure(boolean trial) {
        CircuitStateChangedEvent transition = null;
        lock.lock();
        try {
            Instant now = clock.instant();
            if (state == State.CLOSED) {
                consecutiveFailures++;
                lastFailureTime = now;
                if (consecutiveFailures >= failureThreshold) {
                    transition = moveTo(State.OPEN, now);
                }
            } else if (state == State.HALF_OPEN && trial) {
                consecutiveFailures++;
                lastFailureTime = now;
                trialInFlight = false;
                transition = moveTo(State.OPEN, now);
            }
        } finally {
            lock.unlock();
        }
        publish(transition);
    }

    // Caller holds the lock
    private CircuitStateChangedEvent moveTo(State next, Instant now) {
        State previous = state;
        state = next;
        return new CircuitStateChangedEvent(destination, previous, next, consecutiveFailures, now);
    }

    private void publish(CircuitStateChangedEvent event) {
        if (event == null) {
            return;
        }
        if (event.to() == State.OPEN) {
            LOG.warn("Circuit breaker for {} OPEN after {} consecutive failures",
                    destination.tag(), event.consecutiveFailures());
        } else {
            LOG.info("Circuit breaker for {} {} -> {}", destination.tag(), event.from(), event.to());
        }
        publisher.publishEvent(event);
    }

    public Destination getDestination() {
        return destination;
    }

    public State getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastFailureTime() {
        lock.lock();
        try {
            return lastFailureTime;
        } finally {
            lock.unlock();
        }
    }
}
