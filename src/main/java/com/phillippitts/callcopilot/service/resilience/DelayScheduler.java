package com.phillippitts.callcopilot.service.resilience;

import java.time.Duration;

/**
 * Runs a task after a delay. Lets tests observe backoff delays without waiting for them.
 */
@FunctionalInterface
public interface DelayScheduler {

    void schedule(Runnable task, Duration delay);
}
