package com.phillippitts.callcopilot.config;

import com.phillippitts.callcopilot.config.properties.ResilienceProperties;
import com.phillippitts.callcopilot.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.callcopilot.service.resilience.ResilientCaller;
import com.phillippitts.callcopilot.service.resilience.RetryExecutor;
import com.phillippitts.callcopilot.service.resilience.RetryPolicy;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Wires the retry executor and the per-destination circuit breakers from
 * {@code copilot.resilience.*}.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(ResilienceProperties properties) {
        ResilienceProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxRetries(), retry.getInitialDelay(), retry.getMaxDelay(),
                retry.getBackoffMultiplier());
    }

    @Bean
    public RetryExecutor retryExecutor(RetryPolicy retryPolicy,
                                       @Qualifier("retryScheduler") ScheduledExecutorService retryScheduler) {
        return new RetryExecutor(retryPolicy,
                (task, delay) -> retryScheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceProperties properties, Clock clock,
                                                         ApplicationEventPublisher publisher) {
        ResilienceProperties.Breaker breaker = properties.getBreaker();
        return new CircuitBreakerRegistry(breaker.getFailureThreshold(), breaker.getRecoveryTimeout(), clock,
                publisher);
    }

    @Bean
    public ResilientCaller resilientCaller(RetryExecutor retryExecutor, CircuitBreakerRegistry registry) {
        return new ResilientCaller(retryExecutor, registry);
    }
}
