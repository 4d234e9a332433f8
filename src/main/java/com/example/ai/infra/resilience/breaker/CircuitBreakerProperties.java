package com.example.ai.infra.resilience.breaker;

import lombok.Getter;
import lombok.Setter;

/**
 * Circuit breaker tuning. Bound under {@code ai.resilience.breaker} when used through Spring.
 */
@Getter
@Setter
public class CircuitBreakerProperties {

    /** Failure ratio (0,1] inside the monitoring window that trips the breaker. */
    private double failureThreshold = 0.5d;

    /** Minimum number of outcomes in the window before the ratio is evaluated. */
    private int requestThreshold = 10;

    /** Time spent OPEN before trial requests are admitted. */
    private long resetTimeoutMs = 60_000L;

    /** Age limit of the outcomes that count toward the failure ratio. */
    private long monitoringWindowMs = 120_000L;

    /** Trials admitted per half-open episode; all of them must succeed to close. */
    private int halfOpenTrialCount = 3;

    /** Hard cap on retained outcomes, regardless of age. */
    private int windowCapacity = 1024;

    /**
     * Whether a cancelled call counts as a failure.
     *
     * <p>Default false: cancellation is a caller-side signal, and a cancelled half-open trial gives its slot back.</p>
     */
    private boolean cancellationCountsAsFailure = false;

    // adaptive bounds (used by AdaptiveCircuitBreaker only)
    private boolean adaptiveThresholds = true;
    private double minFailureThreshold = 0.3d;
    private double maxFailureThreshold = 0.8d;
    private boolean adaptiveTimeout = true;
    private long minResetTimeoutMs = 30_000L;
    private long maxResetTimeoutMs = 300_000L;
    private boolean healthScoreEnabled = true;
    /** Health score decay per elapsed monitoring window (0-1). */
    private double healthDecayRate = 0.1d;

    /** Trial success ratio a gradual recovery expects before it resets a half-open breaker. */
    private double halfOpenSuccessRate = 0.8d;

    public CircuitBreakerProperties copy() {
        CircuitBreakerProperties c = new CircuitBreakerProperties();
        c.failureThreshold = failureThreshold;
        c.requestThreshold = requestThreshold;
        c.resetTimeoutMs = resetTimeoutMs;
        c.monitoringWindowMs = monitoringWindowMs;
        c.halfOpenTrialCount = halfOpenTrialCount;
        c.windowCapacity = windowCapacity;
        c.cancellationCountsAsFailure = cancellationCountsAsFailure;
        c.adaptiveThresholds = adaptiveThresholds;
        c.minFailureThreshold = minFailureThreshold;
        c.maxFailureThreshold = maxFailureThreshold;
        c.adaptiveTimeout = adaptiveTimeout;
        c.minResetTimeoutMs = minResetTimeoutMs;
        c.maxResetTimeoutMs = maxResetTimeoutMs;
        c.healthScoreEnabled = healthScoreEnabled;
        c.healthDecayRate = healthDecayRate;
        c.halfOpenSuccessRate = halfOpenSuccessRate;
        return c;
    }

    /**
     * @throws IllegalArgumentException when a value is outside its documented range
     */
    public CircuitBreakerProperties validate() {
        if (!(failureThreshold > 0.0d && failureThreshold <= 1.0d)) {
            throw new IllegalArgumentException("failureThreshold must be in (0,1]: " + failureThreshold);
        }
        if (requestThreshold < 1) {
            throw new IllegalArgumentException("requestThreshold must be >= 1: " + requestThreshold);
        }
        if (resetTimeoutMs <= 0) {
            throw new IllegalArgumentException("resetTimeoutMs must be > 0: " + resetTimeoutMs);
        }
        if (monitoringWindowMs <= 0) {
            throw new IllegalArgumentException("monitoringWindowMs must be > 0: " + monitoringWindowMs);
        }
        if (halfOpenTrialCount < 1) {
            throw new IllegalArgumentException("halfOpenTrialCount must be >= 1: " + halfOpenTrialCount);
        }
        if (windowCapacity < requestThreshold) {
            throw new IllegalArgumentException("windowCapacity must be >= requestThreshold: " + windowCapacity);
        }
        if (!(minFailureThreshold > 0.0d && minFailureThreshold <= 1.0d)) {
            throw new IllegalArgumentException("minFailureThreshold must be in (0,1]: " + minFailureThreshold);
        }
        if (!(maxFailureThreshold > 0.0d && maxFailureThreshold <= 1.0d)) {
            throw new IllegalArgumentException("maxFailureThreshold must be in (0,1]: " + maxFailureThreshold);
        }
        if (minFailureThreshold > maxFailureThreshold) {
            throw new IllegalArgumentException("minFailureThreshold > maxFailureThreshold");
        }
        if (minResetTimeoutMs <= 0) {
            throw new IllegalArgumentException("minResetTimeoutMs must be > 0: " + minResetTimeoutMs);
        }
        if (minResetTimeoutMs > maxResetTimeoutMs) {
            throw new IllegalArgumentException("minResetTimeoutMs > maxResetTimeoutMs");
        }
        if (healthDecayRate < 0.0d || healthDecayRate > 1.0d) {
            throw new IllegalArgumentException("healthDecayRate must be in [0,1]: " + healthDecayRate);
        }
        if (halfOpenSuccessRate < 0.0d || halfOpenSuccessRate > 1.0d) {
            throw new IllegalArgumentException("halfOpenSuccessRate must be in [0,1]: " + halfOpenSuccessRate);
        }
        return this;
    }
}
