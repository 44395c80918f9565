package com.phillippitts.selfspy.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the flush coordinator: timing, retries and
 * per-transaction timeout.
 */
@ConfigurationProperties(prefix = "selfspy.flush")
@Validated
public class FlushProperties {

    /** Maximum time between flushes. */
    @NotNull
    private Duration interval = Duration.ofSeconds(5);

    /** Attempts per drained snapshot before it is discarded. */
    @Positive(message = "Max attempts must be positive")
    private int maxAttempts = 3;

    /** Backoff before the second attempt. */
    @NotNull
    private Duration initialBackoff = Duration.ofMillis(200);

    /** Upper bound for any single backoff. */
    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(5);

    @DecimalMin(value = "1.0", message = "Backoff multiplier must be >= 1.0")
    private double backoffMultiplier = 2.0;

    /** Bound on one store transaction attempt; exceeding it counts as a failed attempt. */
    @NotNull
    private Duration transactionTimeout = Duration.ofSeconds(10);

    /** How long stop() waits for the final flush. */
    @NotNull
    private Duration stopTimeout = Duration.ofSeconds(30);

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public Duration getTransactionTimeout() {
        return transactionTimeout;
    }

    public void setTransactionTimeout(Duration transactionTimeout) {
        this.transactionTimeout = transactionTimeout;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public void setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = stopTimeout;
    }

    /**
     * Backoff to wait after the given failed attempt (1-based), capped at {@link #getMaxBackoff()}.
     */
    public Duration backoffAfter(int failedAttempt) {
        double millis = initialBackoff.toMillis() * Math.pow(backoffMultiplier, Math.max(0, failedAttempt - 1));
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
