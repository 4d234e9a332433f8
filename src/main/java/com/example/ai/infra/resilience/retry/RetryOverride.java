package com.example.ai.infra.resilience.retry;

import lombok.Getter;
import lombok.Setter;

/**
 * Per-error-type replacement of any subset of {@link RetryPolicyConfig} fields.
 * Null means "keep the base value".
 */
@Getter
@Setter
public class RetryOverride {
    private Integer maxRetries;
    private Long initialDelayMs;
    private Long maxDelayMs;
    private BackoffStrategy strategy;
    private Double multiplier;
    private Double jitter;
    private Long timeoutMs;
    private Boolean retryImmediately;

    public RetryOverride copy() {
        RetryOverride o = new RetryOverride();
        o.maxRetries = maxRetries;
        o.initialDelayMs = initialDelayMs;
        o.maxDelayMs = maxDelayMs;
        o.strategy = strategy;
        o.multiplier = multiplier;
        o.jitter = jitter;
        o.timeoutMs = timeoutMs;
        o.retryImmediately = retryImmediately;
        return o;
    }

    void applyTo(RetryPolicyConfig target) {
        if (maxRetries != null) {
            target.setMaxRetries(maxRetries);
        }
        if (initialDelayMs != null) {
            target.setInitialDelayMs(initialDelayMs);
        }
        if (maxDelayMs != null) {
            target.setMaxDelayMs(maxDelayMs);
        }
        if (strategy != null) {
            target.setStrategy(strategy);
        }
        if (multiplier != null) {
            target.setMultiplier(multiplier);
        }
        if (jitter != null) {
            target.setJitter(jitter);
        }
        if (timeoutMs != null) {
            target.setTimeoutMs(timeoutMs);
        }
        if (retryImmediately != null) {
            target.setRetryImmediately(retryImmediately);
        }
    }
}
