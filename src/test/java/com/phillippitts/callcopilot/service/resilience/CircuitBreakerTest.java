package com.phillippitts.callcopilot.service.resilience;

import com.phillippitts.callcopilot.exception.CircuitOpenException;
import com.phillippitts.callcopilot.exception.UpstreamException;
import com.phillippitts.callcopilot.testutil.EventCapturingPublisher;
import com.phillippitts.callcopilot.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private static final int THRESHOLD = 5;
    private static final Duration RECOVERY = Duration.ofSeconds(60);

    private MutableClock clock;
    private EventCapturingPublisher publisher;
    private CircuitBreaker breaker;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        publisher = new EventCapturingPublisher();
        breaker = new CircuitBreaker(Destination.KB, THRESHOLD, RECOVERY, clock, publisher);
        invocations = new AtomicInteger();
    }

    private CompletableFuture<String> failing() {
        return breaker.call(() -> {
            invocations.incrementAndGet();
            return CompletableFuture.failedFuture(new UpstreamException("down", "kb", 503, true));
        });
    }

    private CompletableFuture<String> succeeding() {
        return breaker.call(() -> {
            invocations.incrementAndGet();
            return CompletableFuture.completedFuture("ok");
        });
    }

    private void tripBreaker() {
        for (int i = 0; i < THRESHOLD; i++) {
            failing();
        }
    }

    @Test
    void staysClosedBelowThreshold() {
        for (int i = 0; i < THRESHOLD - 1; i++) {
            failing();
        }

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isEqualTo(THRESHOLD - 1);
        assertThat(publisher.eventsOfType(CircuitStateChangedEvent.class)).isEmpty();
    }

    @Test
    void opensAtThresholdAndRejectsWithoutInvoking() {
        tripBreaker();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.getLastFailureTime()).isEqualTo(clock.instant());

        CompletableFuture<String> rejected = succeeding();

        assertThat(invocations.get()).isEqualTo(THRESHOLD);
        assertThatThrownBy(rejected::join).hasCauseInstanceOf(CircuitOpenException.class);
    }

    @Test
    void successResetsFailureCount() {
        failing();
        failing();
        succeeding();

        assertThat(breaker.getConsecutiveFailures()).isZero();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void remainsOpenBeforeRecoveryTimeout() {
        tripBreaker();
        clock.advance(RECOVERY.minusSeconds(1));

        assertThat(breaker.tryAcquirePermission()).isFalse();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    void halfOpenTrialSuccessCloses() {
        tripBreaker();
        clock.advance(RECOVERY);

        assertThat(succeeding().join()).isEqualTo("ok");

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isZero();
        assertThat(publisher.eventsOfType(CircuitStateChangedEvent.class))
                .extracting(CircuitStateChangedEvent::to)
                .containsExactly(CircuitBreaker.State.OPEN, CircuitBreaker.State.HALF_OPEN,
                        CircuitBreaker.State.CLOSED);
    }

    @Test
    void halfOpenTrialFailureReopensAndRestartsTimer() {
        tripBreaker();
        clock.advance(RECOVERY);

        failing();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.getLastFailureTime()).isEqualTo(clock.instant());

        clock.advance(RECOVERY.minusSeconds(1));
        assertThat(breaker.tryAcquirePermission()).isFalse();
    }

    @Test
    void halfOpenAllowsOnlyOneTrialCall() {
        tripBreaker();
        clock.advance(RECOVERY);
        CompletableFuture<String> pending = new CompletableFuture<>();

        CompletableFuture<String> trial = breaker.call(() -> pending);
        CompletableFuture<String> second = succeeding();

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        assertThatThrownBy(second::join).hasCauseInstanceOf(CircuitOpenException.class);

        pending.complete("done");
        assertThat(trial.join()).isEqualTo("done");
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void lateSuccessFromCallAdmittedWhileClosedDoesNotCloseOpenBreaker() {
        CompletableFuture<String> slow = new CompletableFuture<>();
        CompletableFuture<String> admittedEarly = breaker.call(() -> slow);
        tripBreaker();
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

        slow.complete("late");

        assertThat(admittedEarly.join()).isEqualTo("late");
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(breaker.getConsecutiveFailures()).isEqualTo(THRESHOLD);
        assertThat(breaker.getLastFailureTime()).isEqualTo(clock.instant());

        CompletableFuture<String> rejected = succeeding();
        assertThat(invocations.get()).isEqualTo(THRESHOLD);
        assertThatThrownBy(rejected::join).hasCauseInstanceOf(CircuitOpenException.class);
    }

    @Test
    void lateFailureFromCallAdmittedWhileClosedDoesNotEndHalfOpenTrial() {
        CompletableFuture<String> slow = new CompletableFuture<>();
        breaker.call(() -> slow);
        tripBreaker();
        clock.advance(RECOVERY);
        CompletableFuture<String> pending = new CompletableFuture<>();
        CompletableFuture<String> trial = breaker.call(() -> pending);

        slow.completeExceptionally(new UpstreamException("late", "kb", 503, true));
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);

        pending.complete("recovered");
        assertThat(trial.join()).isEqualTo("recovered");
        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breaker.getConsecutiveFailures()).isZero();
    }

    @Test
    void transitionEventsCarryDestinationAndFailureCount() {
        tripBreaker();

        CircuitStateChangedEvent opened = publisher.eventsOfType(CircuitStateChangedEvent.class).get(0);
        assertThat(opened.destination()).isEqualTo(Destination.KB);
        assertThat(opened.from()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(opened.consecutiveFailures()).isEqualTo(THRESHOLD);
        assertThat(opened.at()).isEqualTo(clock.instant());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new CircuitBreaker(Destination.KB, 0, RECOVERY, clock, publisher))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
