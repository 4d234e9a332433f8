package com.example.ai.infra.resilience.retry;

import lombok.Getter;
import lombok.Setter;

/**
 * {@link RetryPolicyConfig} plus the retry budget, breaker coordination and adaptive backoff switches.
 */
@Getter
@Setter
public class AdvancedRetryConfig extends RetryPolicyConfig {

    /** Label used in logs, metrics and budget errors. */
    private String name = "default";

    /** Retry-consuming calls allowed per budget bucket. */
    private int retryBudget = 100;
    private long budgetWindowMs = 60_000L;

    /** Run the whole retry loop inside the supplied breaker. */
    private boolean circuitBreakerIntegration = true;

    private boolean adaptiveBackoff = true;

    /** Success rate below which the adaptive multiplier grows. */
    private double adaptiveThreshold = 0.7d;

    @Override
    public AdvancedRetryConfig copy() {
        AdvancedRetryConfig c = new AdvancedRetryConfig();
        copyInto(c);
        c.name = name;
        c.retryBudget = retryBudget;
        c.budgetWindowMs = budgetWindowMs;
        c.circuitBreakerIntegration = circuitBreakerIntegration;
        c.adaptiveBackoff = adaptiveBackoff;
        c.adaptiveThreshold = adaptiveThreshold;
        return c;
    }

    @Override
    public AdvancedRetryConfig validate() {
        super.validate();
        if (retryBudget < 0) {
            throw new IllegalArgumentException("retryBudget must be >= 0: " + retryBudget);
        }
        if (budgetWindowMs <= 0) {
            throw new IllegalArgumentException("budgetWindowMs must be > 0: " + budgetWindowMs);
        }
        if (adaptiveThreshold < 0.0d || adaptiveThreshold > 1.0d) {
            throw new IllegalArgumentException("adaptiveThreshold must be in [0,1]: " + adaptiveThreshold);
        }
        return this;
    }
}
