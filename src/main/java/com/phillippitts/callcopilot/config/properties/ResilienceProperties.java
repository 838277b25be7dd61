package com.phillippitts.callcopilot.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Retry and circuit-breaker tuning shared by every outbound destination.
 */
@ConfigurationProperties(prefix = "copilot.resilience")
@Validated
public class ResilienceProperties {

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Breaker breaker = new Breaker();

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Breaker getBreaker() {
        return breaker;
    }

    public void setBreaker(Breaker breaker) {
        this.breaker = breaker;
    }

    /**
     * Exponential backoff settings.
     */
    public static class Retry {
        /** Additional attempts after the first one. */
        @PositiveOrZero(message = "Max retries must not be negative")
        private int maxRetries = 3;

        @NotNull
        private Duration initialDelay = Duration.ofSeconds(1);

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(60);

        @DecimalMin(value = "1.0", message = "Backoff multiplier must be at least 1.0")
        private double backoffMultiplier = 2.0;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    /**
     * Circuit breaker settings, applied to each destination independently.
     */
    public static class Breaker {
        @Positive(message = "Failure threshold must be positive")
        private int failureThreshold = 5;

        @NotNull
        private Duration recoveryTimeout = Duration.ofSeconds(60);

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getRecoveryTimeout() {
            return recoveryTimeout;
        }

        public void setRecoveryTimeout(Duration recoveryTimeout) {
            this.recoveryTimeout = recoveryTimeout;
        }
    }
}
