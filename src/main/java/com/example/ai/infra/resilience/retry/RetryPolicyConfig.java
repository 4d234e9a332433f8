package com.example.ai.infra.resilience.retry;

import com.example.ai.infra.resilience.error.ErrorType;
import lombok.Getter;
import lombok.Setter;

import java.util.EnumMap;
import java.util.Map;

/**
 * Retry schedule. Bound under {@code ai.resilience.retry} when used through Spring.
 */
@Getter
@Setter
public class RetryPolicyConfig {

    /** Retries after the first attempt; the operation runs at most {@code maxRetries + 1} times. */
    private int maxRetries = 3;
    private long initialDelayMs = 1_000L;
    private long maxDelayMs = 30_000L;
    private BackoffStrategy strategy = BackoffStrategy.EXPONENTIAL;
    private double multiplier = 2.0d;

    /** Uniform perturbation of ±{@code jitter * delay}; 0 disables it. */
    private double jitter = 0.1d;

    /** Upper bound per attempt; {@code <= 0} runs attempts inline and unbounded. */
    private long timeoutMs = 30_000L;

    /** Skip the delay before the first retry. */
    private boolean retryImmediately = false;

    private Map<ErrorType, RetryOverride> errorPolicies = new EnumMap<>(ErrorType.class);

    public RetryPolicyConfig copy() {
        RetryPolicyConfig c = new RetryPolicyConfig();
        copyInto(c);
        return c;
    }

    protected void copyInto(RetryPolicyConfig c) {
        c.maxRetries = maxRetries;
        c.initialDelayMs = initialDelayMs;
        c.maxDelayMs = maxDelayMs;
        c.strategy = strategy;
        c.multiplier = multiplier;
        c.jitter = jitter;
        c.timeoutMs = timeoutMs;
        c.retryImmediately = retryImmediately;
        EnumMap<ErrorType, RetryOverride> policies = new EnumMap<>(ErrorType.class);
        if (errorPolicies != null) {
            errorPolicies.forEach((k, v) -> {
                if (k != null && v != null) {
                    policies.put(k, v.copy());
                }
            });
        }
        c.errorPolicies = policies;
    }

    /** Fluent helper for Java callers. */
    public RetryPolicyConfig withErrorPolicy(ErrorType type, RetryOverride override) {
        if (errorPolicies == null) {
            errorPolicies = new EnumMap<>(ErrorType.class);
        }
        errorPolicies.put(type, override);
        return this;
    }

    /**
     * Base values with the override for {@code type} laid over them. Returns a plain copy when
     * {@code type} is null or has no override.
     */
    public RetryPolicyConfig effective(ErrorType type) {
        RetryPolicyConfig base = new RetryPolicyConfig();
        copyInto(base);
        base.errorPolicies = new EnumMap<>(ErrorType.class);
        if (type != null && errorPolicies != null) {
            RetryOverride o = errorPolicies.get(type);
            if (o != null) {
                o.applyTo(base);
            }
        }
        return base;
    }

    /**
     * @throws IllegalArgumentException when a value is outside its documented range
     */
    public RetryPolicyConfig validate() {
        check(this, "");
        if (errorPolicies != null) {
            for (ErrorType t : errorPolicies.keySet()) {
                check(effective(t), "errorPolicies[" + t.code() + "].");
            }
        }
        return this;
    }

    private static void check(RetryPolicyConfig c, String prefix) {
        if (c.maxRetries < 0) {
            throw new IllegalArgumentException(prefix + "maxRetries must be >= 0: " + c.maxRetries);
        }
        if (c.initialDelayMs < 0) {
            throw new IllegalArgumentException(prefix + "initialDelayMs must be >= 0: " + c.initialDelayMs);
        }
        if (c.maxDelayMs < 0) {
            throw new IllegalArgumentException(prefix + "maxDelayMs must be >= 0: " + c.maxDelayMs);
        }
        if (c.strategy == null) {
            throw new IllegalArgumentException(prefix + "strategy must not be null");
        }
        if (c.multiplier < 0.0d) {
            throw new IllegalArgumentException(prefix + "multiplier must be >= 0: " + c.multiplier);
        }
        if (c.jitter < 0.0d || c.jitter > 1.0d) {
            throw new IllegalArgumentException(prefix + "jitter must be in [0,1]: " + c.jitter);
        }
    }
}
